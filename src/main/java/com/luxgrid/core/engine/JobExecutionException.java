package com.luxgrid.core.engine;

import com.luxgrid.core.LuxgridException;

/**
 * Thrown when an external process cannot be launched or waited on.
 * Always isolated to the job it belongs to.
 */
public class JobExecutionException extends LuxgridException {
    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
