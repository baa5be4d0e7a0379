package com.aerostar.transform.api;

import com.aerostar.core.bus.EventBus;
import com.aerostar.core.events.Event;
import com.aerostar.core.model.Exclusion;
import com.aerostar.core.model.ExclusionReport;
import com.aerostar.transform.config.TransformConfig;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * State of one transform run. A new context is created for every run, so nothing leaks
 * between invocations.
 */
public record TransformContext(
        TransformConfig config,
        EventBus eventBus,
        Clock clock,
        ExclusionReport.Builder exclusions
) {
    public TransformContext {
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(exclusions, "exclusions is required");
    }

    public static TransformContext of(TransformConfig config, EventBus eventBus, Clock clock) {
        return new TransformContext(config, eventBus, clock, new ExclusionReport.Builder());
    }

    public Instant now() {
        return clock.instant();
    }

    public void publish(Event event) {
        eventBus.publish(event);
    }

    public void exclude(Exclusion exclusion) {
        exclusions.add(exclusion);
    }
}
