package com.astrazeneca.cfdna.data.scopedata;

import java.util.Collections;
import java.util.List;

/**
 * Lines of one VCF file split to meta header lines ("##"), the column header line ("#CHROM") and data lines.
 */
public class VcfLines {
    public final List<String> metaLines;
    /**
     * Column header line, null if the file has none
     */
    public final String columnHeader;
    public final List<String> dataLines;

    public VcfLines(List<String> metaLines, String columnHeader, List<String> dataLines) {
        this.metaLines = Collections.unmodifiableList(metaLines);
        this.columnHeader = columnHeader;
        this.dataLines = Collections.unmodifiableList(dataLines);
    }

    static final int FIRST_SAMPLE_COLUMN = 9;

    /**
     * @return name of the last sample column of the column header, null if there is no header or no sample column
     */
    public String sampleColumnName() {
        if (columnHeader == null) {
            return null;
        }
        String[] columns = columnHeader.trim().split("\\s+");
        return columns.length > FIRST_SAMPLE_COLUMN ? columns[columns.length - 1] : null;
    }
}
