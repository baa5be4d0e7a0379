package com.aerostar.core.events;

import java.time.Instant;

public record StageCompleted(
        Instant timestamp,
        String stage,
        int inputCount,
        int outputCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "StageCompleted";
    }
}
