package com.aerostar.service.io;

import com.aerostar.core.model.AodFact;
import com.aerostar.core.model.DateDimension;
import com.aerostar.core.model.SiteDimension;
import com.aerostar.core.model.StarSchema;
import com.aerostar.core.model.WavelengthDimension;
import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes the four star-schema tables as {@code <table>.csv} files for the warehouse loader.
 * Missing values are written as empty cells.
 */
public final class StarSchemaWriter {
    private StarSchemaWriter() {
    }

    public static Map<String, Path> write(StarSchema schema, Path outputDir) {
        Map<String, Path> written = new LinkedHashMap<>();
        written.put(AodFact.TABLE, writeTable(outputDir, AodFact.TABLE, AodFact.COLUMNS, schema.facts(), StarSchemaWriter::factRow));
        written.put(DateDimension.TABLE, writeTable(outputDir, DateDimension.TABLE, DateDimension.COLUMNS, schema.dates(), StarSchemaWriter::dateRow));
        written.put(SiteDimension.TABLE, writeTable(outputDir, SiteDimension.TABLE, SiteDimension.COLUMNS, schema.sites(), StarSchemaWriter::siteRow));
        written.put(WavelengthDimension.TABLE, writeTable(outputDir, WavelengthDimension.TABLE, WavelengthDimension.COLUMNS,
                schema.wavelengths(), StarSchemaWriter::wavelengthRow));
        return written;
    }

    private static <T> Path writeTable(Path outputDir, String table, List<String> columns, List<T> rows, Function<T, String[]> toRow) {
        Path file = outputDir.resolve(table + ".csv");
        Path tmp = outputDir.resolve(table + ".csv.tmp");
        try {
            Files.createDirectories(outputDir);
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(writer)) {
                csv.writeNext(columns.toArray(String[]::new), false);
                for (T row : rows) {
                    csv.writeNext(toRow.apply(row), false);
                }
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return file;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write table " + table + " to " + file, e);
        }
    }

    static String[] factRow(AodFact fact) {
        return new String[]{
                String.valueOf(fact.factId()),
                String.valueOf(fact.idDate()),
                String.valueOf(fact.idWavelength()),
                String.valueOf(fact.idSite()),
                fact.particleClass().label(),
                number(fact.aodValue()),
                number(fact.precipitableWater()),
                number(fact.angstromExponent())
        };
    }

    static String[] dateRow(DateDimension date) {
        return new String[]{
                String.valueOf(date.idDate()),
                date.date().toString(),
                String.valueOf(date.year()),
                String.valueOf(date.month()),
                String.valueOf(date.day()),
                String.valueOf(date.dayOfYear())
        };
    }

    static String[] siteRow(SiteDimension site) {
        return new String[]{
                String.valueOf(site.idSite()),
                site.siteName(),
                number(site.latitude()),
                number(site.longitude()),
                number(site.elevation()),
                text(site.country()),
                text(site.continent()),
                text(site.region())
        };
    }

    static String[] wavelengthRow(WavelengthDimension wavelength) {
        return new String[]{
                String.valueOf(wavelength.idWavelength()),
                String.valueOf(wavelength.wavelengthNm()),
                wavelength.spectralBand(),
                wavelength.sensitiveAerosol()
        };
    }

    private static String number(Double value) {
        return value == null ? "" : BigDecimal.valueOf(value).toPlainString();
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
