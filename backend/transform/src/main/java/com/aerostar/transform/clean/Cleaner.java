package com.aerostar.transform.clean;

import com.aerostar.core.error.RecordParseException;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.Exclusion;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.model.RawRecord;
import com.aerostar.core.model.RawTable;
import com.aerostar.transform.api.TransformContext;
import com.aerostar.transform.config.InputColumns;
import com.aerostar.transform.config.TransformConfig;
import com.aerostar.transform.config.WavelengthColumn;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Turns raw string tokens into typed values. The sentinel and any non-numeric token become
 * {@code null}; a row whose date or site cannot be read is excluded on its own.
 */
public final class Cleaner {
    public static final String STAGE = "cleaner";

    private final InputColumns columns;
    private final DateTimeFormatter dateFormat;
    private final double sentinel;

    public Cleaner(TransformConfig config) {
        this.columns = config.columns();
        this.dateFormat = DateTimeFormatter.ofPattern(config.datePattern()).withResolverStyle(ResolverStyle.STRICT);
        this.sentinel = config.sentinel();
    }

    public List<CleanedRecord> clean(RawTable table, List<WavelengthColumn> wavelengths, TransformContext ctx) {
        List<CleanedRecord> cleaned = new ArrayList<>(table.size());
        for (RawRecord raw : table.records()) {
            try {
                cleaned.add(cleanRecord(raw, wavelengths));
            } catch (RecordParseException e) {
                ctx.exclude(new Exclusion(
                        ExclusionReason.RECORD_PARSE_ERROR,
                        STAGE,
                        raw.rowNumber(),
                        trimToNull(raw.value(columns.site())),
                        e.getMessage()
                ));
            }
        }
        return cleaned;
    }

    CleanedRecord cleanRecord(RawRecord raw, List<WavelengthColumn> wavelengths) {
        String site = trimToNull(raw.value(columns.site()));
        if (site == null) {
            throw new RecordParseException(raw.rowNumber(), "missing site identifier");
        }
        LocalDate date = parseDate(raw);
        Double latitude = measurement(raw, columns.latitude());
        Double longitude = measurement(raw, columns.longitude());

        TreeMap<Integer, Double> aod = new TreeMap<>();
        for (WavelengthColumn wavelength : wavelengths) {
            aod.put(wavelength.wavelengthNm(), measurement(raw, wavelength.column()));
        }

        return new CleanedRecord(
                raw.rowNumber(),
                site,
                latitude,
                longitude,
                measurement(raw, columns.elevation()),
                date,
                aod,
                measurement(raw, columns.angstromExponent()),
                measurement(raw, columns.precipitableWater()),
                validCoordinates(latitude, longitude)
        );
    }

    public static boolean validCoordinates(Double latitude, Double longitude) {
        return latitude != null && longitude != null
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }

    private LocalDate parseDate(RawRecord raw) {
        String token = trimToNull(raw.value(columns.date()));
        if (token == null) {
            throw new RecordParseException(raw.rowNumber(), "missing date");
        }
        try {
            return LocalDate.parse(token, dateFormat);
        } catch (DateTimeParseException e) {
            throw new RecordParseException(raw.rowNumber(), "unparseable date '" + token + "'", e);
        }
    }

    private Double measurement(RawRecord raw, String column) {
        if (column == null) {
            return null;
        }
        return parseMeasurement(raw.value(column));
    }

    Double parseMeasurement(String token) {
        String text = trimToNull(token);
        if (text == null) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException ignored) {
            return null;
        }
        if (!Double.isFinite(value) || value == sentinel) {
            return null;
        }
        // -0.0 and 0.0 must produce the same site key
        return value == 0.0 ? 0.0 : value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
