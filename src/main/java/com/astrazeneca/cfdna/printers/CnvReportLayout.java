package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.cfdna.modules.CnvRecordExtractor.CELLULARITY_FIELD;
import static com.astrazeneca.cfdna.modules.CnvRecordExtractor.GENDER;
import static com.astrazeneca.cfdna.modules.CnvRecordExtractor.MAPD_FIELD;

public class CnvReportLayout extends ReportLayout {
    private static final List<String> HEADER = Collections.unmodifiableList(Arrays.asList(
            "Chr", "Gene", "Start", "End", "Length", "Tiles", "CN", "FD", "p-val", "Med_Mol_Cov", "Med_Read_Cov"));
    private static final int[] WIDTHS = {8, 8, 11, 11, 11, 8, 8, 8, 8, 14, 14};

    @Override
    public List<String> header() {
        return HEADER;
    }

    @Override
    public int[] columnWidths(List<SampleReport> reports, SampleReport sample) {
        return WIDTHS.clone();
    }

    @Override
    public String banner(SampleReport sample) {
        SampleIdentity identity = sample.identity;
        return "::: CNV Data For " + identity.name()
                + " (Gender: " + identity.metadata(GENDER)
                + ", Cellularity: " + identity.metadata(CELLULARITY_FIELD)
                + ", MAPD: " + identity.metadata(MAPD_FIELD) + ") :::";
    }

    @Override
    public String emptyMarker() {
        return ">>>>  No Reportable CNVs Found in Sample  <<<<";
    }

    @Override
    public List<String> rawSampleHeader() {
        return Arrays.asList("Sample", "Gender", "MAPD", "Cellularity");
    }

    @Override
    public List<String> rawSampleValues(SampleIdentity identity) {
        return Arrays.asList(identity.name(), identity.metadata(GENDER), identity.metadata(MAPD_FIELD),
                identity.metadata(CELLULARITY_FIELD));
    }
}
