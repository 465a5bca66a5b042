package com.factory.stockkeeper.exception;

public class ValidationException extends ManufacturingException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_FAILED";
    }
}
