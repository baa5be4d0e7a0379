package com.aerostar.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticleClass {
    FINE("fine"),
    COARSE("coarse"),
    MIXED("mixed"),
    UNKNOWN("unknown");

    private final String label;

    ParticleClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
