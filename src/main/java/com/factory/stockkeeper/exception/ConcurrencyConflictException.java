package com.factory.stockkeeper.exception;

public class ConcurrencyConflictException extends ManufacturingException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CONCURRENCY_CONFLICT";
    }
}
