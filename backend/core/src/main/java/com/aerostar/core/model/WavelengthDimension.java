package com.aerostar.core.model;

import java.util.List;

public record WavelengthDimension(
        int idWavelength,
        int wavelengthNm,
        String spectralBand,
        String sensitiveAerosol
) {
    public static final String TABLE = "Dim_Wavelength";
    public static final List<String> COLUMNS = List.of("id_wavelength", "Wavelength_nm", "Spectral_Band", "Sensitive_Aerosol");
}
