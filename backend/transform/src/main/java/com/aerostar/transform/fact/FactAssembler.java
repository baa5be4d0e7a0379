package com.aerostar.transform.fact;

import com.aerostar.core.model.AodFact;
import com.aerostar.core.model.Exclusion;
import com.aerostar.core.model.ExclusionReason;
import com.aerostar.core.model.LongMeasurement;
import com.aerostar.transform.api.TransformContext;
import com.aerostar.transform.dimension.Dimensions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves each measurement's natural keys to surrogate keys. Measurements that do not
 * resolve in every dimension are reported and left out; the rest get dense fact ids.
 */
public final class FactAssembler {
    public static final String STAGE = "factAssembler";

    public List<AodFact> assemble(List<LongMeasurement> measurements, Dimensions dimensions, TransformContext ctx) {
        List<AodFact> facts = new ArrayList<>(measurements.size());
        for (LongMeasurement measurement : measurements) {
            Optional<Integer> site = dimensions.siteKey(measurement.site());
            if (site.isEmpty()) {
                exclude(ctx, ExclusionReason.UNRESOLVED_SITE, measurement, "site not in Dim_Site");
                continue;
            }
            Optional<Integer> date = dimensions.dateKey(measurement.date());
            if (date.isEmpty()) {
                exclude(ctx, ExclusionReason.UNRESOLVED_DATE, measurement, "date " + measurement.date() + " not in Dim_Date");
                continue;
            }
            Optional<Integer> wavelength = dimensions.wavelengthKey(measurement.wavelengthNm());
            if (wavelength.isEmpty()) {
                exclude(ctx, ExclusionReason.UNRESOLVED_WAVELENGTH, measurement,
                        measurement.wavelengthNm() + " nm not in Dim_Wavelength");
                continue;
            }
            facts.add(new AodFact(
                    facts.size() + 1,
                    date.get(),
                    wavelength.get(),
                    site.get(),
                    measurement.particleClass(),
                    measurement.aodValue(),
                    measurement.precipitableWater(),
                    measurement.angstromExponent()
            ));
        }
        return facts;
    }

    private static void exclude(TransformContext ctx, ExclusionReason reason, LongMeasurement measurement, String detail) {
        ctx.exclude(new Exclusion(
                reason,
                STAGE,
                measurement.sourceRow(),
                measurement.site().name(),
                measurement.wavelengthNm() + " nm: " + detail
        ));
    }
}
