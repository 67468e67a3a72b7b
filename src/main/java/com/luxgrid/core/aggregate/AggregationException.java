package com.luxgrid.core.aggregate;

import com.luxgrid.core.LuxgridException;

/**
 * Thrown when there is nothing to aggregate. Fatal to the aggregation stage only.
 */
public class AggregationException extends LuxgridException {
    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
