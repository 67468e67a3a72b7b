package com.luxgrid.core;

/**
 * Base type for Luxgrid failures.
 */
public class LuxgridException extends RuntimeException {
    public LuxgridException(String message) {
        super(message);
    }

    public LuxgridException(String message, Throwable cause) {
        super(message, cause);
    }
}
