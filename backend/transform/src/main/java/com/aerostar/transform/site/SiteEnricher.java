package com.aerostar.transform.site;

import com.aerostar.core.error.CoordinateValidationException;
import com.aerostar.core.events.EnrichmentSkipped;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.Exclusion;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.model.GeoLocation;
import com.aerostar.core.model.SiteKey;
import com.aerostar.transform.api.TransformContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reduces cleaned rows to distinct sites, drops sites the cleaner flagged as having unusable
 * coordinates and attaches geography when a {@link GeoLookup} is available.
 */
public final class SiteEnricher {
    public static final String STAGE = "siteEnricher";
    private static final Logger LOGGER = Logger.getLogger(SiteEnricher.class.getName());

    private final GeoLookup geoLookup;

    public SiteEnricher(GeoLookup geoLookup) {
        this.geoLookup = geoLookup == null ? GeoLookup.unavailable() : geoLookup;
    }

    public List<EnrichedSite> enrich(List<CleanedRecord> records, TransformContext ctx) {
        Map<SiteKey, Boolean> candidates = new LinkedHashMap<>();
        for (CleanedRecord record : records) {
            candidates.putIfAbsent(record.siteKey(), record.coordinatesValid());
        }

        boolean lookupEnabled = geoLookup.available();
        if (!lookupEnabled) {
            ctx.publish(new EnrichmentSkipped(ctx.now(), "no geographic lookup configured"));
        }

        List<EnrichedSite> sites = new ArrayList<>(candidates.size());
        for (Map.Entry<SiteKey, Boolean> candidate : candidates.entrySet()) {
            SiteKey site = candidate.getKey();
            try {
                validate(site, candidate.getValue());
            } catch (CoordinateValidationException e) {
                ctx.exclude(new Exclusion(ExclusionReason.COORDINATE_VALIDATION_ERROR, STAGE, null, site.name(), e.getMessage()));
                continue;
            }
            GeoLocation location = null;
            if (lookupEnabled) {
                try {
                    location = geoLookup.locate(site.latitude(), site.longitude()).orElse(null);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Geographic lookup failed; enrichment disabled for this run", e);
                    ctx.publish(new EnrichmentSkipped(ctx.now(), "lookup failed: " + e.getMessage()));
                    lookupEnabled = false;
                }
            }
            sites.add(new EnrichedSite(site, location));
        }
        return sites;
    }

    static void validate(SiteKey site, boolean coordinatesValid) {
        if (coordinatesValid) {
            return;
        }
        if (site.latitude() == null || site.longitude() == null) {
            throw new CoordinateValidationException(site, "Site " + site.name() + " has no coordinates");
        }
        throw new CoordinateValidationException(site, "Site " + site.name() + " has out-of-range coordinates ("
                + site.latitude() + ", " + site.longitude() + ")");
    }
}
