package com.aerostar.core.error;

import com.aerostar.core.model.SiteKey;

/**
 * A site's coordinate pair is missing or out of range. The site and its measurements are
 * excluded; the run continues.
 */
public class CoordinateValidationException extends RuntimeException {
    private final SiteKey site;

    public CoordinateValidationException(SiteKey site, String message) {
        super(message);
        this.site = site;
    }

    public SiteKey site() {
        return site;
    }
}
