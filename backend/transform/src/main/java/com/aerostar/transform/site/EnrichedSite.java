package com.aerostar.transform.site;

import com.aerostar.core.model.GeoLocation;
import com.aerostar.core.model.SiteKey;

import java.util.Optional;

public record EnrichedSite(SiteKey key, GeoLocation location) {
    public Optional<GeoLocation> geo() {
        return Optional.ofNullable(location);
    }
}
