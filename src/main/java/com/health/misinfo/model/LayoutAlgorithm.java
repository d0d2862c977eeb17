package com.health.misinfo.model;

import com.health.misinfo.exception.UnsupportedLayoutException;

import java.util.Locale;

/**
 * The fixed set of 2D layout algorithms offered for the interaction graph.
 */
public enum LayoutAlgorithm {
    FORCE_DIRECTED(true, "spring"),
    CIRCULAR(false, "circle"),
    RANDOM(true, "randomized"),
    STRESS_MAJORIZATION(false, "kamada-kawai");

    private final boolean seeded;
    private final String alias;

    LayoutAlgorithm(boolean seeded, String alias) {
        this.seeded = seeded;
        this.alias = alias;
    }

    /** Whether the algorithm draws random numbers and therefore needs a seed. */
    public boolean isSeeded() {
        return seeded;
    }

    /**
     * Resolves "force-directed", "FORCE_DIRECTED", "spring", "kamada-kawai", etc.
     *
     * @throws UnsupportedLayoutException for null or unknown names
     */
    public static LayoutAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedLayoutException(String.valueOf(name));
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (LayoutAlgorithm algorithm : values()) {
            String canonical = algorithm.name().toLowerCase(Locale.ROOT).replace('_', '-');
            if (canonical.equals(normalized) || algorithm.alias.equals(normalized)) {
                return algorithm;
            }
        }
        throw new UnsupportedLayoutException(name);
    }
}
