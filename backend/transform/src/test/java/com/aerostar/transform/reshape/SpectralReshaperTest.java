package com.aerostar.transform.reshape;

import com.aerostar.core.model.ClassifiedRecord;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.LongMeasurement;
import com.aerostar.core.model.ParticleClass;
import com.aerostar.core.model.SiteKey;
import com.aerostar.transform.config.WavelengthColumn;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpectralReshaperTest {
    private static final List<WavelengthColumn> WAVELENGTHS = List.of(
            WavelengthColumn.of("AOD_870nm"),
            WavelengthColumn.of("AOD_340nm"),
            WavelengthColumn.of("AOD_500nm")
    );

    private final SpectralReshaper reshaper = new SpectralReshaper();

    @Test
    void emitsOneRowPerNonMissingReading() {
        List<CleanedRecord> records = List.of(
                record(1, 0.5, null, 0.2),
                record(2, null, null, null),
                record(3, 0.1, 0.2, 0.3),
                record(4, null, 0.4, null)
        );

        List<LongMeasurement> measurements = reshaper.reshape(classify(records), WAVELENGTHS);

        assertEquals(SpectralReshaper.countReadings(records), measurements.size());
        assertEquals(6, measurements.size());
        assertTrue(measurements.stream().noneMatch(m -> m.sourceRow() == 2));
    }

    @Test
    void ordersByRowThenWavelengthAndCarriesRowAttributes() {
        CleanedRecord record = record(7, 0.5, null, 0.2);

        List<LongMeasurement> measurements = reshaper.reshape(
                List.of(new ClassifiedRecord(record, ParticleClass.MIXED)),
                WAVELENGTHS
        );

        assertEquals(List.of(340, 870), measurements.stream().map(LongMeasurement::wavelengthNm).toList());
        LongMeasurement first = measurements.get(0);
        assertEquals(0.5, first.aodValue());
        assertEquals(ParticleClass.MIXED, first.particleClass());
        assertEquals(1.3, first.angstromExponent());
        assertEquals(2.4, first.precipitableWater());
        assertEquals(new SiteKey("Site_A", 12.0, 34.0, 56.0), first.site());
        assertEquals(LocalDate.of(2020, 6, 7), first.date());
        assertEquals(7, first.sourceRow());
    }

    @Test
    void ignoresWavelengthsThatAreNotRequested() {
        CleanedRecord record = record(1, 0.5, 0.6, 0.7);

        List<LongMeasurement> measurements = reshaper.reshape(
                classify(List.of(record)),
                List.of(WavelengthColumn.of("AOD_500nm"))
        );

        assertEquals(1, measurements.size());
        assertEquals(500, measurements.get(0).wavelengthNm());
        assertEquals(0.6, measurements.get(0).aodValue());
    }

    private static List<ClassifiedRecord> classify(List<CleanedRecord> records) {
        return records.stream().map(record -> new ClassifiedRecord(record, ParticleClass.FINE)).toList();
    }

    private static CleanedRecord record(int row, Double aod340, Double aod500, Double aod870) {
        TreeMap<Integer, Double> aod = new TreeMap<>();
        List<Double> values = Arrays.asList(aod340, aod500, aod870);
        int[] wavelengths = {340, 500, 870};
        for (int i = 0; i < wavelengths.length; i++) {
            aod.put(wavelengths[i], values.get(i));
        }
        return new CleanedRecord(row, "Site_A", 12.0, 34.0, 56.0, LocalDate.of(2020, 6, row), aod, 1.3, 2.4, true);
    }
}
