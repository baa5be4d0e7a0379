package com.aerostar.transform;

import com.aerostar.core.bus.EventBus;
import com.aerostar.core.error.SchemaMismatchException;
import com.aerostar.core.events.RecordsExcluded;
import com.aerostar.core.events.StageCompleted;
import com.aerostar.core.events.TransformCompleted;
import com.aerostar.core.events.TransformStarted;
import com.aerostar.core.model.AodFact;
import com.aerostar.core.model.ClassifiedRecord;
import com.aerostar.core.model.CleanedRecord;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.model.ExclusionReport;
import com.aerostar.core.model.LongMeasurement;
import com.aerostar.core.model.RawTable;
import com.aerostar.core.model.StarSchema;
import com.aerostar.transform.api.TransformContext;
import com.aerostar.transform.api.TransformResult;
import com.aerostar.transform.classify.ParticleClassifier;
import com.aerostar.transform.clean.Cleaner;
import com.aerostar.transform.config.TransformConfig;
import com.aerostar.transform.config.WavelengthColumn;
import com.aerostar.transform.dimension.DimensionBuilder;
import com.aerostar.transform.dimension.Dimensions;
import com.aerostar.transform.fact.FactAssembler;
import com.aerostar.transform.reshape.SpectralLookup;
import com.aerostar.transform.reshape.SpectralReshaper;
import com.aerostar.transform.site.EnrichedSite;
import com.aerostar.transform.site.GeoLookup;
import com.aerostar.transform.site.SiteEnricher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs the full pipeline over one raw table: clean, classify, reshape, site enrichment,
 * dimensions and facts. Row- and site-level problems are recorded in the returned
 * {@link ExclusionReport}; a missing structural column raises {@link SchemaMismatchException}.
 */
public final class StarSchemaTransform {
    private static final Logger LOGGER = Logger.getLogger(StarSchemaTransform.class.getName());

    private final TransformConfig config;
    private final EventBus eventBus;
    private final Clock clock;
    private final Cleaner cleaner;
    private final ParticleClassifier classifier;
    private final SpectralReshaper reshaper;
    private final SiteEnricher siteEnricher;
    private final DimensionBuilder dimensionBuilder;
    private final FactAssembler factAssembler;

    public StarSchemaTransform(TransformConfig config) {
        this(config, GeoLookup.unavailable(), new EventBus(), Clock.systemUTC());
    }

    public StarSchemaTransform(TransformConfig config, GeoLookup geoLookup, EventBus eventBus, Clock clock) {
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
        this.cleaner = new Cleaner(config);
        this.classifier = new ParticleClassifier(config.particleThresholds());
        this.reshaper = new SpectralReshaper();
        this.siteEnricher = new SiteEnricher(geoLookup);
        this.dimensionBuilder = new DimensionBuilder(SpectralLookup.from(config));
        this.factAssembler = new FactAssembler();
    }

    public TransformResult transform(RawTable table) {
        List<WavelengthColumn> wavelengths = resolveSchema(table);
        TransformContext ctx = TransformContext.of(config, eventBus, clock);
        Instant startedAt = ctx.now();
        ctx.publish(new TransformStarted(startedAt, table.size(), wavelengths.size()));

        List<CleanedRecord> cleaned = stage(ctx, Cleaner.STAGE, table.size(),
                () -> cleaner.clean(table, wavelengths, ctx));
        List<ClassifiedRecord> classified = stage(ctx, ParticleClassifier.STAGE, cleaned.size(),
                () -> classifier.classifyAll(cleaned));
        List<LongMeasurement> measurements = stage(ctx, SpectralReshaper.STAGE, classified.size(),
                () -> reshaper.reshape(classified, wavelengths));
        List<EnrichedSite> sites = stage(ctx, SiteEnricher.STAGE, cleaned.size(),
                () -> siteEnricher.enrich(cleaned, ctx));
        Dimensions dimensions = stage(ctx, DimensionBuilder.STAGE, cleaned.size(),
                () -> dimensionBuilder.build(cleaned, wavelengths, sites));
        List<AodFact> facts = stage(ctx, FactAssembler.STAGE, measurements.size(),
                () -> factAssembler.assemble(measurements, dimensions, ctx));

        StarSchema schema = new StarSchema(facts, dimensions.dates(), dimensions.sites(), dimensions.wavelengths());
        ExclusionReport report = ctx.exclusions().build();
        TransformResult result = new TransformResult(schema, report);

        ctx.publish(new TransformCompleted(
                ctx.now(),
                facts.size(),
                schema.dates().size(),
                schema.sites().size(),
                schema.wavelengths().size(),
                report.total(),
                Duration.between(startedAt, ctx.now()).toMillis()
        ));
        LOGGER.info("Transform completed: " + result.summary());
        report.counts().forEach((reason, count) -> LOGGER.warning("Excluded " + count + " item(s): " + reason));
        return result;
    }

    /**
     * Checks the structural columns and returns the configured wavelength columns present in
     * the table.
     */
    public List<WavelengthColumn> resolveSchema(RawTable table) {
        List<String> missing = new ArrayList<>();
        for (String column : config.columns().required()) {
            if (!table.hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException("Input table is missing required columns", missing);
        }

        List<WavelengthColumn> present = new ArrayList<>();
        List<String> absent = new ArrayList<>();
        for (WavelengthColumn column : config.wavelengthColumns()) {
            if (table.hasColumn(column.column())) {
                present.add(column);
            } else {
                absent.add(column.column());
            }
        }
        if (present.isEmpty()) {
            throw new SchemaMismatchException("Input table has none of the configured wavelength columns", absent);
        }
        if (!absent.isEmpty()) {
            LOGGER.fine("Configured wavelength columns not in input: " + absent);
        }
        return List.copyOf(present);
    }

    private <T> T stage(TransformContext ctx, String name, int inputCount, Supplier<T> body) {
        Instant started = ctx.now();
        Map<ExclusionReason, Long> before = countsByReason(ctx);
        T output = body.get();
        ctx.publish(new StageCompleted(
                ctx.now(),
                name,
                inputCount,
                outputSize(output),
                Duration.between(started, ctx.now()).toMillis()
        ));
        for (ExclusionReason reason : ExclusionReason.values()) {
            long added = ctx.exclusions().count(reason) - before.get(reason);
            if (added > 0) {
                ctx.publish(new RecordsExcluded(ctx.now(), name, reason, added));
            }
        }
        return output;
    }

    private static Map<ExclusionReason, Long> countsByReason(TransformContext ctx) {
        Map<ExclusionReason, Long> counts = new EnumMap<>(ExclusionReason.class);
        for (ExclusionReason reason : ExclusionReason.values()) {
            counts.put(reason, ctx.exclusions().count(reason));
        }
        return counts;
    }

    private static int outputSize(Object output) {
        if (output instanceof List<?> list) {
            return list.size();
        }
        if (output instanceof Dimensions dimensions) {
            return dimensions.dates().size() + dimensions.sites().size() + dimensions.wavelengths().size();
        }
        return 0;
    }
}
