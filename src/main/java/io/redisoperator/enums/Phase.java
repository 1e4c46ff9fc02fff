package io.redisoperator.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle phase reported in a topology object's status.
 */
public enum Phase {
    PENDING("Pending"),
    CREATING("Creating"),
    READY("Ready"),
    DEGRADED("Degraded"),
    FAILED("Failed"),
    INVALID("Invalid");

    private final String displayName;

    Phase(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Ready and Degraded topologies are serving traffic.
     */
    public boolean isServing() {
        return this == READY || this == DEGRADED;
    }

    @JsonCreator
    public static Phase fromString(String value) {
        if (value == null) {
            return null;
        }
        for (Phase phase : values()) {
            if (phase.displayName.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }
}
