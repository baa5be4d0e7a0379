package com.aerostar.transform.config;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One spectral column of the wide table. When {@code wavelengthNm} is not given it is parsed
 * from a column named {@code AOD_<n>nm}.
 */
public record WavelengthColumn(String column, int wavelengthNm) {
    private static final Pattern AOD_COLUMN = Pattern.compile("AOD_(\\d+)nm");

    public WavelengthColumn {
        Objects.requireNonNull(column, "column is required");
        if (wavelengthNm <= 0) {
            wavelengthNm = parseWavelength(column);
        }
    }

    public static WavelengthColumn of(String column) {
        return new WavelengthColumn(column, 0);
    }

    static int parseWavelength(String column) {
        Matcher matcher = AOD_COLUMN.matcher(column.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Cannot derive wavelength from column '" + column + "'; expected AOD_<n>nm");
        }
        int wavelength = Integer.parseInt(matcher.group(1));
        if (wavelength <= 0) {
            throw new IllegalArgumentException("Wavelength must be positive in column '" + column + "'");
        }
        return wavelength;
    }
}
