package com.aerostar.transform.config;

/**
 * Ångström exponent cut-offs. Values at or above {@code fine} are fine particles, values at or
 * below {@code coarse} are coarse particles.
 */
public record ParticleThresholds(double fine, double coarse) {
    public static final double DEFAULT_FINE = 1.5;
    public static final double DEFAULT_COARSE = 1.0;

    public ParticleThresholds {
        if (!(coarse < fine)) {
            throw new IllegalArgumentException("coarse threshold " + coarse + " must be below fine threshold " + fine);
        }
    }

    public static ParticleThresholds defaults() {
        return new ParticleThresholds(DEFAULT_FINE, DEFAULT_COARSE);
    }
}
