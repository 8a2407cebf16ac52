package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.Collections;
import java.util.List;

/**
 * Describes the report of one variant category for printers: column titles and widths, sample banner,
 * the marker of sample without reportable variants and the sample columns of the raw output.
 */
public abstract class ReportLayout {

    public abstract List<String> header();

    /**
     * Widths of columns for pretty print. Zero width means the value is printed as is.
     * @param reports all sample reports of the run
     * @param sample report of the sample being printed
     * @return width of each column
     */
    public abstract int[] columnWidths(List<SampleReport> reports, SampleReport sample);

    public abstract String banner(SampleReport sample);

    public abstract String emptyMarker();

    public abstract List<String> rawSampleHeader();

    public abstract List<String> rawSampleValues(SampleIdentity identity);

    /**
     * Lines printed after the rows of sample in pretty print.
     */
    public List<String> trailer(SampleReport sample) {
        return Collections.emptyList();
    }

    /**
     * Width of the column sized by its longest value plus 2 spaces.
     * @param reports reports which rows are measured
     * @param column index of column
     * @param minWidth the least width returned
     * @return column width
     */
    static int longestValueWidth(List<SampleReport> reports, int column, int minWidth) {
        int width = minWidth;
        for (SampleReport report : reports) {
            for (ReportRow row : report.rows) {
                width = Math.max(width, row.get(column).length() + 2);
            }
        }
        return width;
    }
}
