package com.aerostar.transform.dimension;

import com.aerostar.core.model.DateDimension;
import com.aerostar.core.model.SiteDimension;
import com.aerostar.core.model.SiteKey;
import com.aerostar.core.model.WavelengthDimension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The three dimension tables of one run, with natural-key to surrogate-key lookups.
 */
public final class Dimensions {
    private final List<DateDimension> dates;
    private final List<SiteDimension> sites;
    private final List<WavelengthDimension> wavelengths;
    private final Map<LocalDate, Integer> dateKeys = new HashMap<>();
    private final Map<SiteKey, Integer> siteKeys;
    private final Map<Integer, Integer> wavelengthKeys = new HashMap<>();

    Dimensions(
            List<DateDimension> dates,
            List<SiteDimension> sites,
            Map<SiteKey, Integer> siteKeys,
            List<WavelengthDimension> wavelengths
    ) {
        this.dates = List.copyOf(dates);
        this.sites = List.copyOf(sites);
        this.wavelengths = List.copyOf(wavelengths);
        this.siteKeys = Map.copyOf(siteKeys);
        for (DateDimension date : dates) {
            dateKeys.put(date.date(), date.idDate());
        }
        for (WavelengthDimension wavelength : wavelengths) {
            wavelengthKeys.put(wavelength.wavelengthNm(), wavelength.idWavelength());
        }
    }

    public List<DateDimension> dates() {
        return dates;
    }

    public List<SiteDimension> sites() {
        return sites;
    }

    public List<WavelengthDimension> wavelengths() {
        return wavelengths;
    }

    public Optional<Integer> dateKey(LocalDate date) {
        return Optional.ofNullable(dateKeys.get(date));
    }

    public Optional<Integer> siteKey(SiteKey site) {
        return Optional.ofNullable(siteKeys.get(site));
    }

    public Optional<Integer> wavelengthKey(int wavelengthNm) {
        return Optional.ofNullable(wavelengthKeys.get(wavelengthNm));
    }
}
