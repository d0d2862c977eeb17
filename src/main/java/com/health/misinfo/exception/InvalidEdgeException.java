package com.health.misinfo.exception;

/** Self-loop, missing endpoint or weight below 1. */
public class InvalidEdgeException extends ContextGraphException {

    public InvalidEdgeException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_EDGE";
    }
}
