package com.factory.stockkeeper.exception;

/**
 * Root of the classified errors a manufacturing command or query can report.
 */
public abstract class ManufacturingException extends RuntimeException {

    protected ManufacturingException(String message) {
        super(message);
    }

    protected ManufacturingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable code used in API error bodies.
     */
    public abstract String getErrorCode();
}
