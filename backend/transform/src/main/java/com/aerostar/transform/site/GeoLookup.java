package com.aerostar.transform.site;

import com.aerostar.core.model.GeoLocation;

import java.util.Optional;

/**
 * Optional geographic enrichment. Returns the country, continent and region containing a
 * point, or empty when no boundary matches.
 */
@FunctionalInterface
public interface GeoLookup {
    Optional<GeoLocation> locate(double latitude, double longitude);

    default boolean available() {
        return true;
    }

    static GeoLookup unavailable() {
        return Unavailable.INSTANCE;
    }

    final class Unavailable implements GeoLookup {
        private static final Unavailable INSTANCE = new Unavailable();

        private Unavailable() {
        }

        @Override
        public Optional<GeoLocation> locate(double latitude, double longitude) {
            return Optional.empty();
        }

        @Override
        public boolean available() {
            return false;
        }
    }
}
