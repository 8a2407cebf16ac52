package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.data.SampleReport;

import java.io.PrintStream;
import java.util.List;

/**
 * Universal class for printing the sample reports. The "out" stream is stdout by default and can be set to
 * the output file. The choice of printer is made by parameters --format and --raw.
 */
public abstract class ReportPrinter {
    protected PrintStream out = System.out;
    protected final ReportLayout layout;

    protected ReportPrinter(ReportLayout layout) {
        this.layout = layout;
    }

    /**
     * Prints reports of all samples to the set output
     * @param reports sample reports in output order
     */
    public abstract void print(List<SampleReport> reports);

    /**
     * Set out stream to the parameter.
     * @param printStream print stream where to print reports
     */
    public void setOut(PrintStream printStream) {
        out = printStream;
    }

    public PrintStream getOut() {
        return out;
    }

    /**
     * Factory method for creating needed printer classes for the output format set in configuration.
     * @param format output format
     * @param raw print all samples as one table with the sample columns leading
     * @param layout layout of the report type
     * @return created specific ReportPrinter
     */
    public static ReportPrinter createPrinter(OutputFormat format, boolean raw, ReportLayout layout) {
        if (raw) {
            return new RawReportPrinter(layout);
        }
        switch (format) {
            case CSV:
            case TSV: return new DelimitedReportPrinter(layout, format.delimiter);
            default:  return new PrettyReportPrinter(layout);
        }
    }
}
