package com.aerostar.core.model;

import java.util.Comparator;

/**
 * Natural key of an observation site. Sites with the same name but different coordinates
 * or elevation are distinct sites.
 */
public record SiteKey(String name, Double latitude, Double longitude, Double elevation) implements Comparable<SiteKey> {
    private static final Comparator<Double> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<SiteKey> ORDER = Comparator
            .comparing(SiteKey::name, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(SiteKey::latitude, NULLS_FIRST)
            .thenComparing(SiteKey::longitude, NULLS_FIRST)
            .thenComparing(SiteKey::elevation, NULLS_FIRST);

    @Override
    public int compareTo(SiteKey other) {
        return ORDER.compare(this, other);
    }
}
