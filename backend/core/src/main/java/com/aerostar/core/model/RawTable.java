package com.aerostar.core.model;

import java.util.List;

public record RawTable(List<String> columns, List<RawRecord> records) {
    public RawTable {
        columns = List.copyOf(columns);
        records = List.copyOf(records);
    }

    public boolean hasColumn(String column) {
        return column != null && columns.contains(column);
    }

    public int size() {
        return records.size();
    }
}
