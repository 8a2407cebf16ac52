package com.astrazeneca.cfdna.modes;

import com.astrazeneca.cfdna.Configuration;
import com.astrazeneca.cfdna.modules.CnvRecordExtractor;
import com.astrazeneca.cfdna.modules.RecordExtractor;
import com.astrazeneca.cfdna.postprocessmodules.CnvPostProcessModule;
import com.astrazeneca.cfdna.postprocessmodules.PostProcessModule;
import com.astrazeneca.cfdna.printers.CnvReportLayout;
import com.astrazeneca.cfdna.printers.ReportLayout;

/**
 * Mode building the CNV report.
 */
public class CnvReportMode extends AbstractReportMode {

    public CnvReportMode(Configuration conf) {
        super(conf);
    }

    @Override
    protected RecordExtractor extractor() {
        return new CnvRecordExtractor();
    }

    @Override
    protected PostProcessModule postProcessModule() {
        return new CnvPostProcessModule(criteria);
    }

    @Override
    protected ReportLayout layout() {
        return new CnvReportLayout();
    }
}
