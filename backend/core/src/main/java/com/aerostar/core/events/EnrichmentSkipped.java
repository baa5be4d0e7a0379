package com.aerostar.core.events;

import java.time.Instant;

public record EnrichmentSkipped(Instant timestamp, String reason) implements Event {
    @Override
    public String type() {
        return "EnrichmentSkipped";
    }
}
