package com.aerostar.service.config;

import com.aerostar.core.util.JsonUtils;
import com.aerostar.transform.config.TransformConfig;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String TRANSFORM_FILE = "transform.json";

    private ConfigLoader() {
    }

    public static TransformConfig loadTransform(Path configDir) {
        return read(configDir.resolve(TRANSFORM_FILE), new TypeReference<>() {
        });
    }

    /**
     * Reads {@code transform.json} when present, otherwise falls back to the AERONET defaults.
     */
    public static TransformConfig loadTransformOrDefaults(Path configDir) {
        if (!Files.exists(configDir.resolve(TRANSFORM_FILE))) {
            return TransformConfig.defaults();
        }
        return loadTransform(configDir);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
