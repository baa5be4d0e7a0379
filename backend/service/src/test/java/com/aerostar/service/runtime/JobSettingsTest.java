package com.aerostar.service.runtime;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JobSettingsTest {
    @Test
    void defaultsApplyWithoutArgumentsOrEnvironment() {
        JobSettings settings = JobSettings.resolve(new String[0], Map.of());

        assertEquals(Path.of(JobSettings.DEFAULT_INPUT), settings.input());
        assertEquals(Path.of("out"), settings.outputDir());
        assertEquals(Path.of("config"), settings.configDir());
        assertEquals(Optional.empty(), settings.boundaries());
    }

    @Test
    void positionalArgumentsAndEnvironmentOverrideDefaults() {
        JobSettings settings = JobSettings.resolve(
                new String[]{"in/aod.csv", "warehouse"},
                Map.of(JobSettings.CONFIG_DIR_ENV, "/etc/aerostar", JobSettings.BOUNDARIES_ENV, " geo/countries.geojson ")
        );

        assertEquals(Path.of("in/aod.csv"), settings.input());
        assertEquals(Path.of("warehouse"), settings.outputDir());
        assertEquals(Path.of("/etc/aerostar"), settings.configDir());
        assertEquals(Optional.of(Path.of("geo/countries.geojson")), settings.boundaries());
    }

    @Test
    void blankBoundaryVariableDisablesEnrichment() {
        JobSettings settings = JobSettings.resolve(new String[]{"a.csv"}, Map.of(JobSettings.BOUNDARIES_ENV, "  "));

        assertEquals(Optional.empty(), settings.boundaries());
    }
}
