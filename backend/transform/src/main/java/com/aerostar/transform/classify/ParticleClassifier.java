package com.aerostar.transform.classify;

import com.aerostar.core.model.ClassifiedRecord;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.ParticleClass;
import com.aerostar.transform.config.ParticleThresholds;

import java.util.List;

public final class ParticleClassifier {
    public static final String STAGE = "particleClassifier";

    private final ParticleThresholds thresholds;

    public ParticleClassifier(ParticleThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public ParticleClass classify(Double angstromExponent) {
        if (angstromExponent == null || angstromExponent.isNaN()) {
            return ParticleClass.UNKNOWN;
        }
        // both cut-offs are inclusive and compared exactly
        if (angstromExponent >= thresholds.fine()) {
            return ParticleClass.FINE;
        }
        if (angstromExponent <= thresholds.coarse()) {
            return ParticleClass.COARSE;
        }
        return ParticleClass.MIXED;
    }

    public List<ClassifiedRecord> classifyAll(List<CleanedRecord> records) {
        return records.stream()
                .map(record -> new ClassifiedRecord(record, classify(record.angstromExponent())))
                .toList();
    }
}
