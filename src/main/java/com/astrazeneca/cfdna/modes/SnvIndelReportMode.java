package com.astrazeneca.cfdna.modes;

import com.astrazeneca.cfdna.Configuration;
import com.astrazeneca.cfdna.annotation.VariantAnnotator;
import com.astrazeneca.cfdna.annotation.VcfExtractorAnnotator;
import com.astrazeneca.cfdna.modules.RecordExtractor;
import com.astrazeneca.cfdna.modules.SnvIndelRecordExtractor;
import com.astrazeneca.cfdna.postprocessmodules.PostProcessModule;
import com.astrazeneca.cfdna.postprocessmodules.SnvIndelPostProcessModule;
import com.astrazeneca.cfdna.printers.ReportLayout;
import com.astrazeneca.cfdna.printers.SnvIndelReportLayout;

/**
 * Mode building the SNV/Indel report. Calls are read through the variant annotator, so its version is checked
 * before any file is processed.
 */
public class SnvIndelReportMode extends AbstractReportMode {
    private final VariantAnnotator annotator;

    public SnvIndelReportMode(Configuration conf, VariantAnnotator annotator) {
        super(conf);
        this.annotator = annotator;
    }

    public SnvIndelReportMode(Configuration conf) {
        this(conf, new VcfExtractorAnnotator(conf.extractor));
    }

    @Override
    protected void checkPreconditions() {
        annotator.checkVersion();
    }

    @Override
    protected RecordExtractor extractor() {
        return new SnvIndelRecordExtractor(annotator, conf.toAnnotatorOptions());
    }

    @Override
    protected PostProcessModule postProcessModule() {
        return new SnvIndelPostProcessModule(criteria);
    }

    @Override
    protected ReportLayout layout() {
        return new SnvIndelReportLayout();
    }
}
