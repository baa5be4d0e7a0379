package com.aerostar.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ExclusionReport(List<Exclusion> exclusions) {
    public ExclusionReport {
        exclusions = List.copyOf(exclusions);
    }

    public long count(ExclusionReason reason) {
        return exclusions.stream().filter(exclusion -> exclusion.reason() == reason).count();
    }

    public Map<ExclusionReason, Long> counts() {
        Map<ExclusionReason, Long> counts = new EnumMap<>(ExclusionReason.class);
        for (Exclusion exclusion : exclusions) {
            counts.merge(exclusion.reason(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    public int total() {
        return exclusions.size();
    }

    public boolean isEmpty() {
        return exclusions.isEmpty();
    }

    /**
     * Collects exclusions while a transform runs. Not thread-safe; one builder per run.
     */
    public static final class Builder {
        private final List<Exclusion> exclusions = new ArrayList<>();

        public Builder add(Exclusion exclusion) {
            exclusions.add(exclusion);
            return this;
        }

        public long count(ExclusionReason reason) {
            return exclusions.stream().filter(exclusion -> exclusion.reason() == reason).count();
        }

        public ExclusionReport build() {
            return new ExclusionReport(exclusions);
        }
    }
}
