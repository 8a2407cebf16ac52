package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.List;

/**
 * Prints each sample as the banner, the header row and one delimited row per record.
 */
public class DelimitedReportPrinter extends ReportPrinter {
    private final String delimiter;

    public DelimitedReportPrinter(ReportLayout layout, String delimiter) {
        super(layout);
        this.delimiter = delimiter;
    }

    @Override
    public void print(List<SampleReport> reports) {
        for (SampleReport sample : reports) {
            out.println(layout.banner(sample));
            out.println(String.join(delimiter, layout.header()));
            if (sample.rows.isEmpty()) {
                out.println(layout.emptyMarker().trim());
            }
            for (ReportRow row : sample.rows) {
                out.println(String.join(delimiter, row.values()));
            }
            out.println();
        }
    }
}
