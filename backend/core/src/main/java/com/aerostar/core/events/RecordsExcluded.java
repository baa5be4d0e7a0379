package com.aerostar.core.events;

import com.aerostar.core.model.ExclusionReason;

import java.time.Instant;

public record RecordsExcluded(Instant timestamp, String stage, ExclusionReason reason, long count) implements Event {
    @Override
    public String type() {
        return "RecordsExcluded";
    }
}
