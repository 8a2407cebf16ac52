package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.List;

/**
 * Prints each sample as a table of left aligned columns under the sample banner.
 */
public class PrettyReportPrinter extends ReportPrinter {

    public PrettyReportPrinter(ReportLayout layout) {
        super(layout);
    }

    @Override
    public void print(List<SampleReport> reports) {
        for (SampleReport sample : reports) {
            int[] widths = layout.columnWidths(reports, sample);
            out.println(layout.banner(sample));
            out.println(formatRow(layout.header(), widths));
            if (sample.rows.isEmpty()) {
                out.println(layout.emptyMarker());
            }
            for (ReportRow row : sample.rows) {
                out.println(formatRow(row.values(), widths));
            }
            for (String line : layout.trailer(sample)) {
                out.println(line);
            }
            out.println();
        }
    }

    static String formatRow(List<String> values, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                line.append(' ');
            }
            int width = i < widths.length ? widths[i] : 0;
            line.append(width > 0 ? String.format("%-" + width + "s", values.get(i)) : values.get(i));
        }
        return line.toString().replaceAll("\\s+$", "");
    }
}
