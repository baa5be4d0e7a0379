package com.aerostar.core.model;

import java.util.Objects;

public record ClassifiedRecord(CleanedRecord record, ParticleClass particleClass) {
    public ClassifiedRecord {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(particleClass, "particleClass is required");
    }
}
