package com.aerostar.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One raw input row (one site, one day) as string tokens keyed by column name.
 * {@code rowNumber} is the 1-based position of the row in the source table.
 */
public record RawRecord(int rowNumber, Map<String, String> values) {
    public RawRecord {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String value(String column) {
        return values.get(column);
    }
}
