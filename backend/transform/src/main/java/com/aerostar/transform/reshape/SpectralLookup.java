package com.aerostar.transform.reshape;

import com.aerostar.transform.config.SpectralRule;
import com.aerostar.transform.config.TransformConfig;

import java.util.List;

/**
 * Labels a wavelength with its spectral band and the particle size it discriminates best.
 * Both rule tables are ordered; the first matching rule wins.
 */
public final class SpectralLookup {
    private final List<SpectralRule> bands;
    private final List<SpectralRule> sensitivities;

    public SpectralLookup(List<SpectralRule> bands, List<SpectralRule> sensitivities) {
        this.bands = requireClosed("spectralBands", bands);
        this.sensitivities = requireClosed("sensitivityBands", sensitivities);
    }

    public static SpectralLookup from(TransformConfig config) {
        return new SpectralLookup(config.spectralBands(), config.sensitivityBands());
    }

    public String spectralBand(double wavelengthNm) {
        return firstMatch(bands, wavelengthNm);
    }

    public String sensitivity(double wavelengthNm) {
        return firstMatch(sensitivities, wavelengthNm);
    }

    private static String firstMatch(List<SpectralRule> rules, double wavelengthNm) {
        for (SpectralRule rule : rules) {
            if (rule.matches(wavelengthNm)) {
                return rule.label();
            }
        }
        throw new IllegalStateException("No rule matched " + wavelengthNm + " nm");
    }

    private static List<SpectralRule> requireClosed(String name, List<SpectralRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        if (!rules.get(rules.size() - 1).isCatchAll()) {
            throw new IllegalArgumentException(name + " must end with a rule without an upper bound");
        }
        return List.copyOf(rules);
    }
}
