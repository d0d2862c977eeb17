package com.health.misinfo.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.health.misinfo.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Fact-check state of a post, ordered from least to most confirmed false.
 * Severity strictly increases with confirmation.
 */
public enum VerificationStatus {
    UNDER_REVIEW("Under Review", 0.20),
    DISPUTED("Disputed", 0.40),
    FLAGGED("Flagged", 0.55),
    FACT_CHECKED("Fact-Checked", 0.70),
    DEBUNKED("Debunked", 0.90),
    VERIFIED_FALSE("Verified False", 1.00);

    private final String label;
    private final double severity;

    VerificationStatus(String label, double severity) {
        this.label = label;
        this.severity = severity;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public double getSeverity() {
        return severity;
    }

    /** Accepts the display label ("Verified False") or the constant name ("VERIFIED_FALSE"). */
    @JsonCreator
    public static VerificationStatus fromLabel(String value) {
        if (value == null) {
            throw new InvalidParameterException("verificationStatus is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (VerificationStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new InvalidParameterException("Unknown verification status: " + value);
    }
}
