package com.astrazeneca.cfdna.postprocessmodules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.VariantKey;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Class for preparation of fusion records to the output. Controls are kept in the sample report as they are.
 */
public class FusionPostProcessModule extends PostProcessModule {
    public static final Set<String> NOVEL_IDS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("Non-Targeted", "Novel")));

    public FusionPostProcessModule(FilterCriteria criteria) {
        super(criteria);
    }

    @Override
    protected boolean accept(VariantKey key, FieldSet fields) {
        int count = (int) fields.getDouble("COUNT");
        String filter = fields.get("FILTER");

        if ((count == 0 || "FAIL".equals(filter)) && !criteria.includeReferenceCalls) {
            return false;
        }
        if ("NOCALL".equals(filter) && !criteria.includeNoCalls) {
            return false;
        }
        if (NOVEL_IDS.contains(fields.get("ID")) && !criteria.includeNovel) {
            return false;
        }
        if (!criteria.acceptsGene(fields.get("DRIVER"))) {
            return false;
        }
        return count >= criteria.readCountThreshold;
    }

    /**
     * Fusion (pair.junction), ID, Read_Count, Driver_Gene, Partner_Gene
     */
    @Override
    protected ReportRow project(VariantKey key, FieldSet fields) {
        return new ReportRow(key.part(0) + "." + key.part(1), key.part(2),
                fields.get("COUNT"), fields.get("DRIVER"), fields.get("PARTNER"));
    }
}
