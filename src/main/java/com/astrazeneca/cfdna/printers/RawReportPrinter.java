package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints all samples as one comma delimited table for loading to other tools: one global header, then rows
 * led by the sample columns. Samples without records print nothing.
 */
public class RawReportPrinter extends ReportPrinter {
    static final String DELIMITER = ",";

    public RawReportPrinter(ReportLayout layout) {
        super(layout);
    }

    @Override
    public void print(List<SampleReport> reports) {
        List<String> header = new ArrayList<>(layout.rawSampleHeader());
        header.addAll(layout.header());
        out.println(String.join(DELIMITER, header));

        for (SampleReport sample : reports) {
            List<String> sampleValues = layout.rawSampleValues(sample.identity);
            for (ReportRow row : sample.rows) {
                List<String> values = new ArrayList<>(sampleValues);
                values.addAll(row.values());
                out.println(String.join(DELIMITER, values));
            }
        }
    }
}
