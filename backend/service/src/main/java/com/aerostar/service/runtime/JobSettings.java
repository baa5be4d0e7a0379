package com.aerostar.service.runtime;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public record JobSettings(
        Path input,
        Path outputDir,
        Path configDir,
        Path eventLogFile,
        Optional<Path> boundaries
) {
    public static final String DEFAULT_INPUT = "data/All_Sites_Times_Daily_Averages_AOD20.csv";
    public static final String DEFAULT_OUTPUT = "out";
    public static final String BOUNDARIES_ENV = "AEROSTAR_BOUNDARIES";
    public static final String CONFIG_DIR_ENV = "AEROSTAR_CONFIG_DIR";

    /**
     * Positional arguments are {@code [input.csv] [output-dir]}; the config directory and the
     * optional boundary file come from the environment.
     */
    public static JobSettings resolve(String[] args, Map<String, String> env) {
        Path input = Path.of(args.length > 0 ? args[0] : DEFAULT_INPUT);
        Path output = Path.of(args.length > 1 ? args[1] : DEFAULT_OUTPUT);
        Path configDir = Path.of(env.getOrDefault(CONFIG_DIR_ENV, "config"));
        String boundaries = env.get(BOUNDARIES_ENV);
        return new JobSettings(
                input,
                output,
                configDir,
                Path.of("logs/transform-events.jsonl"),
                boundaries == null || boundaries.isBlank() ? Optional.empty() : Optional.of(Path.of(boundaries.trim()))
        );
    }
}
