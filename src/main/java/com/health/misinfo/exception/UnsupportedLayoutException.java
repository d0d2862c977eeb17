package com.health.misinfo.exception;

public class UnsupportedLayoutException extends ContextGraphException {

    public UnsupportedLayoutException(String algorithm) {
        super("Unsupported layout algorithm: " + algorithm);
    }

    @Override
    public String getCode() {
        return "UNSUPPORTED_LAYOUT";
    }
}
