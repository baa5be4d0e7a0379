package com.aerostar.core.events;

import java.time.Instant;

public record TransformStarted(Instant timestamp, int inputRows, int wavelengthColumns) implements Event {
    @Override
    public String type() {
        return "TransformStarted";
    }
}
