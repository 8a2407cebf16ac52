package com.astrazeneca.cfdna.postprocessmodules;

import com.astrazeneca.cfdna.annotation.SnvIndelSchema;
import com.astrazeneca.cfdna.annotation.SnvIndelSchema.Column;
import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.VariantKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Class for preparation of SNV and Indel calls to the output: gene, VAF and alt molecular coverage filters.
 */
public class SnvIndelPostProcessModule extends PostProcessModule {

    public SnvIndelPostProcessModule(FilterCriteria criteria) {
        super(criteria);
    }

    @Override
    protected boolean accept(VariantKey key, FieldSet fields) {
        return criteria.acceptsGene(fields.get(Column.GENE.title))
                && fields.getDouble(Column.VAF.title) >= criteria.minVaf
                && fields.getDouble(Column.MOL_ALT_COV.title) >= criteria.minAltMolecularCoverage;
    }

    @Override
    protected ReportRow project(VariantKey key, FieldSet fields) {
        List<String> values = new ArrayList<>();
        for (String title : SnvIndelSchema.titles()) {
            values.add(fields.get(title));
        }
        return new ReportRow(values);
    }
}
