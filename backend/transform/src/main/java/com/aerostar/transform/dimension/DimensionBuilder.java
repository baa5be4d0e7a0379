package com.aerostar.transform.dimension;

import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.DateDimension;
import com.aerostar.core.model.GeoLocation;
import com.aerostar.core.model.SiteDimension;
import com.aerostar.core.model.SiteKey;
import com.aerostar.core.model.WavelengthDimension;
import com.aerostar.transform.config.WavelengthColumn;
import com.aerostar.transform.reshape.SpectralLookup;
import com.aerostar.transform.site.EnrichedSite;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds Dim_Date, Dim_Site and Dim_Wavelength. Surrogate keys start at 1 and follow the
 * ascending natural key, so identical input always gets identical keys.
 */
public final class DimensionBuilder {
    public static final String STAGE = "dimensionBuilder";

    private final SpectralLookup spectralLookup;

    public DimensionBuilder(SpectralLookup spectralLookup) {
        this.spectralLookup = spectralLookup;
    }

    public Dimensions build(List<CleanedRecord> records, List<WavelengthColumn> wavelengths, List<EnrichedSite> sites) {
        List<SiteDimension> siteRows = new ArrayList<>();
        Map<SiteKey, Integer> siteKeys = new HashMap<>();
        List<EnrichedSite> orderedSites = sites.stream()
                .sorted(Comparator.comparing(EnrichedSite::key))
                .toList();
        for (EnrichedSite site : orderedSites) {
            int id = siteRows.size() + 1;
            siteRows.add(siteRow(id, site));
            siteKeys.put(site.key(), id);
        }
        return new Dimensions(buildDates(records), siteRows, siteKeys, buildWavelengths(wavelengths));
    }

    List<DateDimension> buildDates(List<CleanedRecord> records) {
        TreeSet<LocalDate> distinct = new TreeSet<>();
        for (CleanedRecord record : records) {
            distinct.add(record.date());
        }
        List<DateDimension> rows = new ArrayList<>(distinct.size());
        for (LocalDate date : distinct) {
            rows.add(DateDimension.of(rows.size() + 1, date));
        }
        return rows;
    }

    List<WavelengthDimension> buildWavelengths(List<WavelengthColumn> wavelengths) {
        TreeSet<Integer> distinct = new TreeSet<>();
        for (WavelengthColumn column : wavelengths) {
            distinct.add(column.wavelengthNm());
        }
        List<WavelengthDimension> rows = new ArrayList<>(distinct.size());
        for (int nm : distinct) {
            rows.add(new WavelengthDimension(
                    rows.size() + 1,
                    nm,
                    spectralLookup.spectralBand(nm),
                    spectralLookup.sensitivity(nm)
            ));
        }
        return rows;
    }

    private static SiteDimension siteRow(int id, EnrichedSite site) {
        SiteKey key = site.key();
        GeoLocation geo = site.geo().orElse(new GeoLocation(null, null, null));
        return new SiteDimension(
                id,
                key.name(),
                key.latitude(),
                key.longitude(),
                key.elevation(),
                geo.country(),
                geo.continent(),
                geo.region()
        );
    }
}
