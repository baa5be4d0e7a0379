package com.aerostar.transform.config;

import java.util.Objects;

/**
 * A labelled wavelength interval bounded from above. A rule without {@code upperBoundNm}
 * matches every wavelength and closes a rule table.
 */
public record SpectralRule(String label, Double upperBoundNm, boolean inclusive) {
    public SpectralRule {
        Objects.requireNonNull(label, "label is required");
    }

    public static SpectralRule below(String label, double upperBoundNm) {
        return new SpectralRule(label, upperBoundNm, false);
    }

    public static SpectralRule upTo(String label, double upperBoundNm) {
        return new SpectralRule(label, upperBoundNm, true);
    }

    public static SpectralRule otherwise(String label) {
        return new SpectralRule(label, null, false);
    }

    public boolean isCatchAll() {
        return upperBoundNm == null;
    }

    public boolean matches(double wavelengthNm) {
        if (upperBoundNm == null) {
            return true;
        }
        return inclusive ? wavelengthNm <= upperBoundNm : wavelengthNm < upperBoundNm;
    }
}
