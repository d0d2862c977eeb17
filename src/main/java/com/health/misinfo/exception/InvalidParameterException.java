package com.health.misinfo.exception;

public class InvalidParameterException extends ContextGraphException {

    public InvalidParameterException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_PARAMETER";
    }
}
