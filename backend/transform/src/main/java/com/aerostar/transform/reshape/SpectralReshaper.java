package com.aerostar.transform.reshape;

import com.aerostar.core.model.ClassifiedRecord;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.LongMeasurement;
import com.aerostar.transform.config.WavelengthColumn;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Wide-to-long reshape. Emits one measurement per (row, wavelength) with a reading; missing
 * readings produce no row, so the output size equals the number of non-missing cells.
 */
public final class SpectralReshaper {
    public static final String STAGE = "spectralReshaper";

    public List<LongMeasurement> reshape(List<ClassifiedRecord> records, List<WavelengthColumn> wavelengths) {
        List<WavelengthColumn> ordered = wavelengths.stream()
                .sorted(Comparator.comparingInt(WavelengthColumn::wavelengthNm))
                .toList();
        List<LongMeasurement> measurements = new ArrayList<>();
        for (ClassifiedRecord classified : records) {
            CleanedRecord record = classified.record();
            for (WavelengthColumn wavelength : ordered) {
                Double aod = record.aod(wavelength.wavelengthNm());
                if (aod == null) {
                    continue;
                }
                measurements.add(new LongMeasurement(
                        record.rowNumber(),
                        record.siteKey(),
                        record.date(),
                        wavelength.wavelengthNm(),
                        aod,
                        classified.particleClass(),
                        record.precipitableWater(),
                        record.angstromExponent()
                ));
            }
        }
        return measurements;
    }

    public static long countReadings(List<CleanedRecord> records) {
        return records.stream()
                .flatMap(record -> record.aodByWavelength().values().stream())
                .filter(value -> value != null)
                .count();
    }
}
