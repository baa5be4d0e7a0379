package com.aerostar.core.model;

import java.time.LocalDate;

/**
 * One AOD reading for a (site, date, wavelength) triple. Only non-missing readings are
 * represented, so {@code aodValue} is always a finite number.
 */
public record LongMeasurement(
        int sourceRow,
        SiteKey site,
        LocalDate date,
        int wavelengthNm,
        double aodValue,
        ParticleClass particleClass,
        Double precipitableWater,
        Double angstromExponent
) {
}
