package com.aerostar.transform.api;

import com.aerostar.core.model.ExclusionReport;
import com.aerostar.core.model.StarSchema;

import java.util.Objects;

public record TransformResult(StarSchema schema, ExclusionReport report) {
    public TransformResult {
        Objects.requireNonNull(schema, "schema is required");
        Objects.requireNonNull(report, "report is required");
    }

    public String summary() {
        return "facts=" + schema.facts().size()
                + " dates=" + schema.dates().size()
                + " sites=" + schema.sites().size()
                + " wavelengths=" + schema.wavelengths().size()
                + " excluded=" + report.counts();
    }
}
