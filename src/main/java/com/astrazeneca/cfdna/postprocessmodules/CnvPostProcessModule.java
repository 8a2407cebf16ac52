package com.astrazeneca.cfdna.postprocessmodules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.VariantKey;
import htsjdk.samtools.util.Log;

/**
 * Class for preparation of CNV records to the output.
 */
public class CnvPostProcessModule extends PostProcessModule {
    private static final Log LOG = Log.getInstance(CnvPostProcessModule.class);
    public static final String NOCALL = "NOCALL";

    private final CnvThresholdFilter thresholdFilter;

    public CnvPostProcessModule(FilterCriteria criteria) {
        super(criteria);
        this.thresholdFilter = new CnvThresholdFilter(criteria);
    }

    @Override
    protected boolean accept(VariantKey key, FieldSet fields) {
        if (!criteria.acceptsGene(gene(key))) {
            return false;
        }
        if (!criteria.includeNoCalls && NOCALL.equals(fields.get("FILTER"))) {
            return false;
        }
        try {
            if (criteria.minTiles > 0 && fields.getDouble("NUMTILES") < criteria.minTiles) {
                return false;
            }
            return thresholdFilter.accept(fields.getDouble("PVAL"), fields.getDouble("CN"), fields.getDouble("FD"));
        } catch (NumberFormatException e) {
            LOG.debug("CNV ", key, " has non-numeric values and is not reported: ", e.getMessage());
            return false;
        }
    }

    /**
     * Chr, Gene, Start, End, Length, Tiles, CN, FD, p-val, Med_Mol_Cov, Med_Read_Cov
     */
    @Override
    protected ReportRow project(VariantKey key, FieldSet fields) {
        return new ReportRow(key.part(0), gene(key), key.part(1),
                fields.get("END"), fields.get("LEN"), fields.get("NUMTILES"), fields.get("CN"), fields.get("FD"),
                fields.get("PVAL"), fields.get("RMMDP"), fields.get("MMDP"));
    }

    private static String gene(VariantKey key) {
        return key.part(2);
    }
}
