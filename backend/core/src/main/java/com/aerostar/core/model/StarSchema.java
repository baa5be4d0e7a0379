package com.aerostar.core.model;

import java.util.List;

public record StarSchema(
        List<AodFact> facts,
        List<DateDimension> dates,
        List<SiteDimension> sites,
        List<WavelengthDimension> wavelengths
) {
    public StarSchema {
        facts = List.copyOf(facts);
        dates = List.copyOf(dates);
        sites = List.copyOf(sites);
        wavelengths = List.copyOf(wavelengths);
    }
}
