package com.astrazeneca.cfdna.modes;

import com.astrazeneca.cfdna.Configuration;
import com.astrazeneca.cfdna.modules.FusionRecordExtractor;
import com.astrazeneca.cfdna.modules.RecordExtractor;
import com.astrazeneca.cfdna.postprocessmodules.FusionPostProcessModule;
import com.astrazeneca.cfdna.postprocessmodules.PostProcessModule;
import com.astrazeneca.cfdna.printers.FusionReportLayout;
import com.astrazeneca.cfdna.printers.ReportLayout;

/**
 * Mode building the fusion report. Control read counts are shown together with the reference calls.
 */
public class FusionReportMode extends AbstractReportMode {

    public FusionReportMode(Configuration conf) {
        super(conf);
    }

    @Override
    protected RecordExtractor extractor() {
        return new FusionRecordExtractor();
    }

    @Override
    protected PostProcessModule postProcessModule() {
        return new FusionPostProcessModule(criteria);
    }

    @Override
    protected ReportLayout layout() {
        return new FusionReportLayout(criteria.genes, conf.ref);
    }
}
