package com.aerostar.core.model;

import java.util.List;

public record AodFact(
        int factId,
        int idDate,
        int idWavelength,
        int idSite,
        ParticleClass particleClass,
        double aodValue,
        Double precipitableWater,
        Double angstromExponent
) {
    public static final String TABLE = "Fact_AOD";
    public static final List<String> COLUMNS = List.of(
            "Fact_ID", "id_date", "id_wavelength", "id_site",
            "Particle_type", "AOD_Value", "Precipitable_Water", "Angstrom_Exponent"
    );
}
