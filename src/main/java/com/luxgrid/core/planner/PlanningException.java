package com.luxgrid.core.planner;

import com.luxgrid.core.LuxgridException;

/**
 * Thrown when planning inputs are missing or malformed. Raised before any
 * external process is launched.
 */
public class PlanningException extends LuxgridException {
    public PlanningException(String message) {
        super(message);
    }
}
