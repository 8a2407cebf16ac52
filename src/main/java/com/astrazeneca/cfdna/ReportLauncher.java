package com.astrazeneca.cfdna;

import com.astrazeneca.cfdna.exception.ConfigurationException;
import com.astrazeneca.cfdna.modes.AbstractReportMode;
import com.astrazeneca.cfdna.modes.CnvReportMode;
import com.astrazeneca.cfdna.modes.FusionReportMode;
import com.astrazeneca.cfdna.modes.SnvIndelReportMode;
import com.astrazeneca.cfdna.modules.VcfHeaderFixer;
import htsjdk.samtools.util.Log;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Class starts the report for current run
 */
public class ReportLauncher {
    private static final Log LOG = Log.getInstance(ReportLauncher.class);

    private final PrintStream stdout;

    public ReportLauncher(PrintStream stdout) {
        this.stdout = stdout;
    }

    public ReportLauncher() {
        this(System.out);
    }

    /**
     * Opens the output and starts the needed mode (cnv/fusion/snv) or the header fix.
     * @param config starting configuration
     */
    public void start(Configuration config) {
        if (config.debug) {
            Log.setGlobalLogLevel(Log.LogLevel.DEBUG);
        }
        if (config.reportType == ReportType.FIXHEADER) {
            fixHeaders(config);
            return;
        }
        AbstractReportMode mode = createMode(config);
        LOG.debug("Filters: ", config.toFilterCriteria());

        PrintStream out = openOutput(config.output);
        try {
            mode.report(mode.createPrinter(out));
        } finally {
            out.flush();
            if (out != stdout) {
                out.close();
            }
        }
    }

    AbstractReportMode createMode(Configuration config) {
        switch (config.reportType) {
            case CNV: return new CnvReportMode(config);
            case FUSION: return new FusionReportMode(config);
            case SNV: return new SnvIndelReportMode(config);
            default: throw new IllegalArgumentException("No report mode for " + config.reportType);
        }
    }

    private void fixHeaders(Configuration config) {
        VcfHeaderFixer fixer = new VcfHeaderFixer();
        for (File vcf : config.files) {
            String output = config.output != null ? config.output : VcfHeaderFixer.defaultOutput(vcf.getPath());
            try (PrintStream out = openFile(output)) {
                fixer.fix(vcf, out);
            }
        }
    }

    private PrintStream openOutput(String output) {
        return output == null ? stdout : openFile(output);
    }

    private PrintStream openFile(String output) {
        LOG.info("Writing results to ", output);
        try {
            return new PrintStream(output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Can't open the output file " + output, e);
        }
    }
}
