package com.aerostar.service.runtime;

import com.aerostar.core.error.SchemaMismatchException;
import com.aerostar.core.events.EnrichmentSkipped;
import com.aerostar.core.events.Event;
import com.aerostar.core.events.TransformCompleted;
import com.aerostar.core.events.TransformStarted;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.util.JsonUtils;
import com.aerostar.service.store.JsonlEventLog;
import com.aerostar.service.support.FixtureUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformJobTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void runWritesTablesExclusionsAndEventLog() throws Exception {
        Path workDir = Files.createTempDirectory("transform-job-");
        JobSettings settings = settings(workDir, Optional.of(FixtureUtils.fixturePath("boundaries.geojson")));
        JsonlEventLog eventLog = new JsonlEventLog(settings.eventLogFile());

        TransformJob.Outcome outcome = new TransformJob(settings, eventLog, CLOCK).run();

        assertEquals(4, outcome.result().schema().facts().size());
        assertEquals(4, outcome.tables().size());
        for (Path table : outcome.tables().values()) {
            assertTrue(Files.exists(table), table + " should exist");
        }

        List<String> sites = Files.readAllLines(settings.outputDir().resolve("Dim_Site.csv"), StandardCharsets.UTF_8);
        assertEquals(List.of(
                "id_site,AERONET_Site,Latitude,Longitude,Elevation,Country,Continent,Region",
                "1,Nowhere,50.0,50.0,20.0,,,",
                "2,Testsite,5.0,5.0,100.0,Testland,Europe,Europe"
        ), sites);
        assertEquals(5, Files.readAllLines(settings.outputDir().resolve("Fact_AOD.csv"), StandardCharsets.UTF_8).size());

        JsonNode exclusions = JsonUtils.objectMapper().readTree(outcome.exclusions().toFile());
        assertEquals(1, exclusions.path("counts").path("RECORD_PARSE_ERROR").asInt());
        assertEquals(1, exclusions.path("counts").path("COORDINATE_VALIDATION_ERROR").asInt());
        assertEquals(3, exclusions.path("counts").path("UNRESOLVED_SITE").asInt());
        assertEquals(5, exclusions.path("report").path("exclusions").size());
        assertEquals(3, outcome.result().report().count(ExclusionReason.UNRESOLVED_SITE));

        List<Event> events = eventLog.readAll();
        assertInstanceOf(TransformStarted.class, events.get(0));
        assertInstanceOf(TransformCompleted.class, events.get(events.size() - 1));
        assertTrue(events.stream().noneMatch(EnrichmentSkipped.class::isInstance));
    }

    @Test
    void missingBoundaryFileSkipsEnrichmentButCompletes() throws Exception {
        Path workDir = Files.createTempDirectory("transform-job-nogeo-");
        JobSettings settings = settings(workDir, Optional.of(workDir.resolve("absent.geojson")));
        JsonlEventLog eventLog = new JsonlEventLog(settings.eventLogFile());

        TransformJob.Outcome outcome = new TransformJob(settings, eventLog, CLOCK).run();

        assertEquals(4, outcome.result().schema().facts().size());
        assertTrue(outcome.result().schema().sites().stream().allMatch(site -> site.country() == null));
        assertEquals(1, eventLog.readAll().stream().filter(EnrichmentSkipped.class::isInstance).count());
    }

    @Test
    void schemaMismatchAbortsBeforeAnyTableIsWritten() throws Exception {
        Path workDir = Files.createTempDirectory("transform-job-mismatch-");
        Path input = workDir.resolve("input.csv");
        Files.writeString(input, "AERONET_Site,AOD_500nm\nSite_A,0.3\n", StandardCharsets.UTF_8);
        JobSettings settings = new JobSettings(input, workDir.resolve("out"), workDir.resolve("config"),
                workDir.resolve("logs/events.jsonl"), Optional.empty());

        TransformJob job = new TransformJob(settings, new JsonlEventLog(settings.eventLogFile()), CLOCK);

        SchemaMismatchException error = assertThrows(SchemaMismatchException.class, job::run);
        assertTrue(error.missingColumns().contains("Date(dd:mm:yyyy)"));
        assertFalse(Files.exists(settings.outputDir().resolve("Fact_AOD.csv")));
    }

    private static JobSettings settings(Path workDir, Optional<Path> boundaries) throws Exception {
        Path input = workDir.resolve("input.csv");
        Files.writeString(input, FixtureUtils.aeronetCsv(
                "Testsite,01:06:2020,0.30,0.28,-999.,1.7,2.0,5.0,5.0,100",
                "Nowhere,02:06:2020,0.10,-999.,0.05,0.7,,50.0,50.0,20",
                "Broken,99:99:2020,0.1,0.1,0.1,1.0,1.0,1.0,1.0,1",
                "Offgrid,01:06:2020,0.2,0.2,0.2,1.2,1.0,95.0,5.0,1"
        ), StandardCharsets.UTF_8);
        return new JobSettings(input, workDir.resolve("out"), workDir.resolve("config"),
                workDir.resolve("logs/events.jsonl"), boundaries);
    }
}
