package com.aerostar.core.model;

import java.util.List;

/**
 * A coordinate-valid observation site. Geographic fields are {@code null} when no
 * enrichment was available for the site.
 */
public record SiteDimension(
        int idSite,
        String siteName,
        double latitude,
        double longitude,
        Double elevation,
        String country,
        String continent,
        String region
) {
    public static final String TABLE = "Dim_Site";
    public static final List<String> COLUMNS = List.of(
            "id_site", "AERONET_Site", "Latitude", "Longitude", "Elevation", "Country", "Continent", "Region"
    );
}
