package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.annotation.SnvIndelSchema;
import com.astrazeneca.cfdna.annotation.SnvIndelSchema.Column;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.Collections;
import java.util.List;

import static com.astrazeneca.cfdna.modules.SnvIndelRecordExtractor.TIMESTAMP;

/**
 * Layout of SNV/Indel report. Widths of Ref, Alt, VarID, CDS and AA columns are taken from the longest value
 * among all samples, so the tables of all samples are aligned the same way.
 */
public class SnvIndelReportLayout extends ReportLayout {
    static final int MIN_WIDTH = 4;

    @Override
    public List<String> header() {
        return SnvIndelSchema.titles();
    }

    @Override
    public int[] columnWidths(List<SampleReport> reports, SampleReport sample) {
        int[] widths = new int[Column.values().length];
        for (Column column : Column.values()) {
            widths[column.ordinal()] = width(column, reports);
        }
        return widths;
    }

    private static int width(Column column, List<SampleReport> reports) {
        switch (column) {
            case POSITION: return 17;
            case VAF: return 9;
            case LOD: return 7;
            case AMP_COV: return 8;
            case MOL_REF_COV:
            case MOL_ALT_COV: return 11;
            case GENE: return 10;
            case TRANSCRIPT: return 15;
            case LOCATION: return 12;
            case FUNCTION: return 9;
            case GENE_CLASS: return 21;
            case VARIANT_CLASS: return 0;
            default: return longestValueWidth(reports, column.ordinal(), MIN_WIDTH);
        }
    }

    @Override
    public String banner(SampleReport sample) {
        return "::: SNV/Indel Data For " + sample.identity.name()
                + " (" + sample.identity.metadata(TIMESTAMP) + ") :::";
    }

    @Override
    public String emptyMarker() {
        return ">>>>  No Reportable SNVs or Indels Found in Sample  <<<<";
    }

    @Override
    public List<String> rawSampleHeader() {
        return Collections.singletonList("Sample");
    }

    @Override
    public List<String> rawSampleValues(SampleIdentity identity) {
        return Collections.singletonList(identity.name());
    }
}
