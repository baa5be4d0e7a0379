package com.aerostar.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A raw row after cleaning. Every measurement is either a finite number or {@code null}
 * (missing); the sentinel never survives into this type.
 *
 * <p>{@code aodByWavelength} has one entry per wavelength column present in the input,
 * keyed by wavelength in nanometers, with {@code null} for a missing reading.
 */
public record CleanedRecord(
        int rowNumber,
        String siteName,
        Double latitude,
        Double longitude,
        Double elevation,
        LocalDate date,
        SortedMap<Integer, Double> aodByWavelength,
        Double angstromExponent,
        Double precipitableWater,
        boolean coordinatesValid
) {
    public CleanedRecord {
        aodByWavelength = Collections.unmodifiableSortedMap(new TreeMap<>(aodByWavelength));
    }

    public SiteKey siteKey() {
        return new SiteKey(siteName, latitude, longitude, elevation);
    }

    public Double aod(int wavelengthNm) {
        return aodByWavelength.get(wavelengthNm);
    }
}
