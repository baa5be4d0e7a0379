package com.aerostar.service.io;

import com.aerostar.core.model.RawRecord;
import com.aerostar.core.model.RawTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a headed CSV file into a {@link RawTable}. Values stay as raw tokens; typing is the
 * cleaner's job.
 */
public final class RawTableReader {
    private static final char BOM = '\uFEFF';

    private RawTableReader() {
    }

    public static RawTable read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                return new RawTable(List.of(), List.of());
            }
            List<String> columns = columns(header);
            List<RawRecord> records = new ArrayList<>();
            int rowNumber = 0;
            String[] row;
            while ((row = csv.readNext()) != null) {
                if (isBlank(row)) {
                    continue;
                }
                rowNumber++;
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    values.put(columns.get(i), i < row.length ? row[i] : null);
                }
                records.add(new RawRecord(rowNumber, values));
            }
            return new RawTable(columns, records);
        } catch (IOException | CsvValidationException e) {
            throw new IllegalStateException("Failed reading raw table from " + file, e);
        }
    }

    private static List<String> columns(String[] header) {
        List<String> columns = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            columns.add(name);
        }
        return columns;
    }

    private static boolean isBlank(String[] row) {
        return row.length == 0 || (row.length == 1 && (row[0] == null || row[0].isBlank()));
    }
}
