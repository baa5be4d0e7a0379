package com.aerostar.core.model;

public enum ExclusionReason {
    RECORD_PARSE_ERROR,
    COORDINATE_VALIDATION_ERROR,
    UNRESOLVED_DATE,
    UNRESOLVED_SITE,
    UNRESOLVED_WAVELENGTH
}
