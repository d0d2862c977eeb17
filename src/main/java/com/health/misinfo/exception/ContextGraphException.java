package com.health.misinfo.exception;

/**
 * Base type for input rejected by the graph and scoring engines. Each subtype carries a
 * stable error code reported to callers.
 */
public abstract class ContextGraphException extends RuntimeException {

    protected ContextGraphException(String message) {
        super(message);
    }

    public abstract String getCode();
}
