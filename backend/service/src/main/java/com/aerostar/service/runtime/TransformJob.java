package com.aerostar.service.runtime;

import com.aerostar.core.bus.EventBus;
import com.aerostar.core.events.Event;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.model.ExclusionReport;
import com.aerostar.core.model.RawTable;
import com.aerostar.core.util.JsonUtils;
import com.aerostar.service.config.ConfigLoader;
import com.aerostar.service.geo.BoundaryGeoLookup;
import com.aerostar.service.io.RawTableReader;
import com.aerostar.service.io.StarSchemaWriter;
import com.aerostar.service.store.EventLog;
import com.aerostar.transform.StarSchemaTransform;
import com.aerostar.transform.api.TransformResult;
import com.aerostar.transform.config.TransformConfig;
import com.aerostar.transform.site.GeoLookup;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One batch run: read the raw CSV, transform it, hand the four tables to the loader as CSV
 * files and write the exclusion report next to them.
 */
public final class TransformJob {
    public static final String EXCLUSIONS_FILE = "exclusions.json";
    private static final Logger LOGGER = Logger.getLogger(TransformJob.class.getName());

    private final JobSettings settings;
    private final EventLog eventLog;
    private final Clock clock;

    public TransformJob(JobSettings settings, EventLog eventLog, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public Outcome run() {
        TransformConfig config = ConfigLoader.loadTransformOrDefaults(settings.configDir());
        GeoLookup geoLookup = geoLookup(settings.boundaries());

        EventBus eventBus = new EventBus();
        eventBus.subscribe(Event.class, eventLog::append);

        LOGGER.info("Reading raw table from " + settings.input());
        RawTable table = RawTableReader.read(settings.input());
        TransformResult result = new StarSchemaTransform(config, geoLookup, eventBus, clock).transform(table);

        Map<String, Path> tables = StarSchemaWriter.write(result.schema(), settings.outputDir());
        Path exclusions = writeExclusions(result.report(), settings.outputDir());
        LOGGER.info("Wrote " + tables.size() + " tables to " + settings.outputDir());
        return new Outcome(result, tables, exclusions);
    }

    static GeoLookup geoLookup(Optional<Path> boundaries) {
        if (boundaries.isEmpty()) {
            return GeoLookup.unavailable();
        }
        Path file = boundaries.get();
        if (!Files.exists(file)) {
            LOGGER.warning("Boundary file " + file + " not found; geographic enrichment skipped");
            return GeoLookup.unavailable();
        }
        try {
            return BoundaryGeoLookup.load(file);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Boundary file " + file + " could not be loaded; geographic enrichment skipped", e);
            return GeoLookup.unavailable();
        }
    }

    private static Path writeExclusions(ExclusionReport report, Path outputDir) {
        Path file = outputDir.resolve(EXCLUSIONS_FILE);
        try {
            Files.createDirectories(outputDir);
            JsonUtils.objectMapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), new ExclusionSummary(report.counts(), report));
            return file;
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write exclusion report " + file, e);
        }
    }

    private record ExclusionSummary(Map<ExclusionReason, Long> counts, ExclusionReport report) {
    }

    public record Outcome(TransformResult result, Map<String, Path> tables, Path exclusions) {
    }
}
