package com.aerostar.core.events;

import java.time.Instant;

public record TransformCompleted(
        Instant timestamp,
        int factRows,
        int dateRows,
        int siteRows,
        int wavelengthRows,
        int excluded,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "TransformCompleted";
    }
}
