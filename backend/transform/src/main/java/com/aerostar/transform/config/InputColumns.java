package com.aerostar.transform.config;

import java.util.List;
import java.util.Objects;

/**
 * Names of the non-spectral columns of the raw table.
 */
public record InputColumns(
        String site,
        String latitude,
        String longitude,
        String elevation,
        String date,
        String angstromExponent,
        String precipitableWater
) {
    public InputColumns {
        Objects.requireNonNull(site, "site column is required");
        Objects.requireNonNull(latitude, "latitude column is required");
        Objects.requireNonNull(longitude, "longitude column is required");
        Objects.requireNonNull(date, "date column is required");
    }

    public static InputColumns aeronet() {
        return new InputColumns(
                "AERONET_Site",
                "Site_Latitude(Degrees)",
                "Site_Longitude(Degrees)",
                "Site_Elevation(m)",
                "Date(dd:mm:yyyy)",
                "440-870_Angstrom_Exponent",
                "Precipitable_Water(cm)"
        );
    }

    /**
     * Columns whose absence aborts the transform. The remaining columns are read as missing
     * when the input does not carry them.
     */
    public List<String> required() {
        return List.of(site, latitude, longitude, date);
    }
}
