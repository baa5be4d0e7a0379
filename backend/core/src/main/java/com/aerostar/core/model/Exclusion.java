package com.aerostar.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One item left out of the output. {@code sourceRow} is absent for site-level exclusions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Exclusion(
        ExclusionReason reason,
        String stage,
        Integer sourceRow,
        String siteName,
        String detail
) {
}
