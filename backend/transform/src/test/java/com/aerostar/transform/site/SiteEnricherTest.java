package com.aerostar.transform.site;

import com.aerostar.core.bus.EventBus;
import com.aerostar.core.events.EnrichmentSkipped;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.model.ExclusionReport;
import com.aerostar.core.model.GeoLocation;
import com.aerostar.core.model.SiteKey;
import com.aerostar.transform.api.TransformContext;
import com.aerostar.transform.clean.Cleaner;
import com.aerostar.transform.config.TransformConfig;
import com.aerostar.transform.support.EventCapture;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SiteEnricherTest {
    private final EventBus bus = new EventBus();
    private final EventCapture capture = new EventCapture(bus);
    private final TransformContext ctx = TransformContext.of(
            TransformConfig.defaults(),
            bus,
            Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC)
    );

    @Test
    void deduplicatesOnNameCoordinatesAndElevation() {
        List<CleanedRecord> records = List.of(
                record(1, "Site_A", 10.0, 20.0, 5.0),
                record(2, "Site_A", 10.0, 20.0, 5.0),
                record(3, "Site_A", 10.0, 20.0, 6.0),
                record(4, "Site_B", -33.9, 18.4, null)
        );

        List<EnrichedSite> sites = new SiteEnricher(GeoLookup.unavailable()).enrich(records, ctx);

        assertEquals(3, sites.size());
        assertEquals(new SiteKey("Site_A", 10.0, 20.0, 5.0), sites.get(0).key());
        assertEquals(new SiteKey("Site_A", 10.0, 20.0, 6.0), sites.get(1).key());
        assertEquals(new SiteKey("Site_B", -33.9, 18.4, null), sites.get(2).key());
    }

    @Test
    void excludesSitesWithInvalidCoordinatesOncePerSite() {
        List<CleanedRecord> records = List.of(
                record(1, "Valid", 45.0, 90.0, 1.0),
                record(2, "Polar", 91.0, 0.0, 1.0),
                record(3, "Polar", 91.0, 0.0, 1.0),
                record(4, "Dateline", 0.0, 181.0, 1.0),
                record(5, "Unplaced", null, 12.0, 1.0)
        );

        List<EnrichedSite> sites = new SiteEnricher(GeoLookup.unavailable()).enrich(records, ctx);

        assertEquals(List.of("Valid"), sites.stream().map(site -> site.key().name()).toList());
        ExclusionReport report = ctx.exclusions().build();
        assertEquals(3, report.count(ExclusionReason.COORDINATE_VALIDATION_ERROR));
        assertTrue(report.exclusions().stream().anyMatch(e -> "Polar".equals(e.siteName()) && e.detail().contains("91.0")));
        assertTrue(report.exclusions().stream().anyMatch(e -> "Unplaced".equals(e.siteName()) && e.detail().contains("no coordinates")));
    }

    @Test
    void siteValidityFollowsTheCleanerFlag() {
        CleanedRecord flagged = new CleanedRecord(1, "Flagged", 10.0, 10.0, 1.0, LocalDate.of(2021, 3, 1),
                new TreeMap<>(), 1.2, 1.1, false);

        List<EnrichedSite> sites = new SiteEnricher(GeoLookup.unavailable())
                .enrich(List.of(flagged, record(2, "Kept", 10.0, 10.0, 1.0)), ctx);

        assertEquals(List.of("Kept"), sites.stream().map(site -> site.key().name()).toList());
        assertEquals(1, ctx.exclusions().build().count(ExclusionReason.COORDINATE_VALIDATION_ERROR));
    }

    @Test
    void attachesGeographyWhenLookupIsAvailable() {
        GeoLookup lookup = (lat, lon) -> lat > 0
                ? Optional.of(new GeoLocation("Spain", "Europe", "Europe"))
                : Optional.empty();

        List<EnrichedSite> sites = new SiteEnricher(lookup).enrich(List.of(
                record(1, "Granada", 37.16, -3.6, 680.0),
                record(2, "Ocean", -40.0, -30.0, 0.0)
        ), ctx);

        assertEquals("Spain", sites.get(0).location().country());
        assertEquals("Europe", sites.get(0).location().continent());
        assertNull(sites.get(1).location());
        assertTrue(capture.byType(EnrichmentSkipped.class).isEmpty());
    }

    @Test
    void missingLookupLeavesFieldsUnsetAndReportsSkip() {
        List<EnrichedSite> sites = new SiteEnricher(null).enrich(List.of(record(1, "Granada", 37.16, -3.6, 680.0)), ctx);

        assertEquals(1, sites.size());
        assertTrue(sites.get(0).geo().isEmpty());
        assertEquals(1, capture.byType(EnrichmentSkipped.class).size());
    }

    @Test
    void failingLookupIsDisabledForTheRestOfTheRun() {
        AtomicInteger calls = new AtomicInteger();
        GeoLookup broken = (lat, lon) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boundary index corrupt");
        };

        List<EnrichedSite> sites = new SiteEnricher(broken).enrich(List.of(
                record(1, "A", 1.0, 1.0, 1.0),
                record(2, "B", 2.0, 2.0, 2.0),
                record(3, "C", 3.0, 3.0, 3.0)
        ), ctx);

        assertEquals(3, sites.size());
        assertEquals(1, calls.get());
        List<EnrichmentSkipped> skipped = capture.byType(EnrichmentSkipped.class);
        assertEquals(1, skipped.size());
        assertTrue(skipped.get(0).reason().contains("boundary index corrupt"));
    }

    private static CleanedRecord record(int row, String site, Double lat, Double lon, Double elevation) {
        return new CleanedRecord(row, site, lat, lon, elevation, LocalDate.of(2021, 3, 1), new TreeMap<>(), 1.2, 1.1,
                Cleaner.validCoordinates(lat, lon));
    }
}
