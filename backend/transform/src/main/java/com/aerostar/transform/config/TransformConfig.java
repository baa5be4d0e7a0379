package com.aerostar.transform.config;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record TransformConfig(
        InputColumns columns,
        String datePattern,
        double sentinel,
        List<WavelengthColumn> wavelengthColumns,
        ParticleThresholds particleThresholds,
        List<SpectralRule> spectralBands,
        List<SpectralRule> sensitivityBands
) {
    public static final double DEFAULT_SENTINEL = -999.0;
    public static final String DEFAULT_DATE_PATTERN = "d:M:uuuu";

    private static final List<Integer> AERONET_WAVELENGTHS = List.of(
            340, 380, 400, 440, 443, 490, 500, 510, 532, 551, 555,
            560, 620, 667, 675, 681, 709, 779, 865, 870, 1020, 1640
    );

    public TransformConfig {
        Objects.requireNonNull(columns, "columns is required");
        Objects.requireNonNull(datePattern, "datePattern is required");
        Objects.requireNonNull(particleThresholds, "particleThresholds is required");
        if (wavelengthColumns == null || wavelengthColumns.isEmpty()) {
            throw new IllegalArgumentException("At least one wavelength column must be configured");
        }
        Set<Integer> seen = new HashSet<>();
        for (WavelengthColumn column : wavelengthColumns) {
            if (!seen.add(column.wavelengthNm())) {
                throw new IllegalArgumentException("Wavelength " + column.wavelengthNm() + " nm is configured more than once");
            }
        }
        wavelengthColumns = List.copyOf(wavelengthColumns);
        spectralBands = List.copyOf(spectralBands);
        sensitivityBands = List.copyOf(sensitivityBands);
    }

    public static TransformConfig defaults() {
        return new TransformConfig(
                InputColumns.aeronet(),
                DEFAULT_DATE_PATTERN,
                DEFAULT_SENTINEL,
                AERONET_WAVELENGTHS.stream().map(nm -> WavelengthColumn.of("AOD_" + nm + "nm")).toList(),
                ParticleThresholds.defaults(),
                defaultSpectralBands(),
                defaultSensitivityBands()
        );
    }

    public static List<SpectralRule> defaultSpectralBands() {
        return List.of(
                SpectralRule.below("UV", 400),
                SpectralRule.upTo("VIS", 700),
                SpectralRule.otherwise("NIR")
        );
    }

    public static List<SpectralRule> defaultSensitivityBands() {
        return List.of(
                SpectralRule.upTo("fine-sensitive", 500),
                SpectralRule.below("balanced", 800),
                SpectralRule.otherwise("coarse-sensitive")
        );
    }

    public TransformConfig withWavelengthColumns(List<WavelengthColumn> columns) {
        return new TransformConfig(this.columns, datePattern, sentinel, columns, particleThresholds, spectralBands, sensitivityBands);
    }
}
