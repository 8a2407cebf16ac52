package com.astrazeneca.cfdna;

import com.astrazeneca.cfdna.exception.ConfigurationException;
import com.astrazeneca.cfdna.printers.OutputFormat;
import org.apache.commons.cli.*;

import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Arrays;

/**
 * Class to parse the parameters from the command line. The first argument is the report type, options of the
 * report and the input files follow it.
 */
public class CmdParser {
    static final String USAGE = "cfdna-report <cnv|fusion|snv|fixheader> [options] <VCF_file(s)>";

    private final PrintStream out;

    public CmdParser(PrintStream out) {
        this.out = out;
    }

    public CmdParser() {
        this(System.out);
    }

    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line or null if help or version was printed
     * @throws ConfigurationException if report type is unknown, options can't be parsed or are wrong
     */
    public Configuration parseParams(String[] args) {
        if (args.length == 0) {
            throw new ConfigurationException("Report type is not set.");
        }
        if ("-h".equals(args[0]) || "--help".equals(args[0])) {
            out.println("USAGE: " + USAGE);
            for (ReportType type : ReportType.values()) {
                out.printf("    %-10s %s%n", type.command, type.description);
            }
            return null;
        }
        ReportType type = ReportType.fromCommand(args[0]);
        if (type == null) {
            throw new ConfigurationException("Unknown report type '" + args[0] + "'.");
        }

        Options options = buildOptions(type);
        CommandLineParser parser = new BasicParser();
        try {
            CommandLine cmd = parser.parse(options, Arrays.copyOfRange(args, 1, args.length));
            if (cmd.hasOption("h")) {
                help(type, options);
                return null;
            }
            if (cmd.hasOption("v")) {
                out.println(type.scriptName + " - " + type.version);
                return null;
            }
            return parseCmd(type, cmd);
        } catch (ParseException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param type report type
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if numeric option can't be parsed
     */
    private Configuration parseCmd(ReportType type, CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();
        config.reportType = type;

        for (String file : cmd.getArgs()) {
            config.files.add(new File(file));
        }
        if (config.files.isEmpty()) {
            throw new ConfigurationException(ConfigurationException.NoInputFilesMessage);
        }
        config.output = cmd.getOptionValue("o");
        config.debug = cmd.hasOption("D");
        if (type == ReportType.FIXHEADER) {
            if (config.output != null && config.files.size() > 1) {
                throw new ConfigurationException(ConfigurationException.SingleOutputForManyFilesMessage);
            }
            return config;
        }

        if (cmd.hasOption("g")) {
            for (String gene : cmd.getOptionValue("g").split(",")) {
                if (!gene.trim().isEmpty()) {
                    config.genes.add(gene.trim());
                }
            }
        }
        config.format = OutputFormat.fromOption(cmd.getOptionValue("f", OutputFormat.PP.option));
        config.raw = cmd.hasOption("r");
        config.nocall = cmd.hasOption("N");
        config.threads = readThreadsCount(cmd);

        switch (type) {
            case CNV:
                config.copyAmp = getDoubleValue(cmd, "copy_amp", 0);
                config.copyLoss = getDoubleValue(cmd, "copy_loss", 0);
                config.foldAmp = getDoubleValue(cmd, "fold_amp", 0);
                config.foldLoss = getDoubleValue(cmd, "fold_loss", 0);
                config.tiles = getIntValue(cmd, "t", 0);
                break;
            case FUSION:
                config.threshold = getIntValue(cmd, "t", Configuration.DEFAULT_FUSION_THRESHOLD);
                config.ref = cmd.hasOption("R");
                config.novel = cmd.hasOption("n");
                break;
            case SNV:
                config.vaf = getDoubleValue(cmd, "vaf", 0);
                config.molCov = getDoubleValue(cmd, "mol-cov", 0);
                config.extractor = cmd.getOptionValue("extractor", config.extractor);
                break;
            default:
                break;
        }
        // conflicting thresholds are reported before any file is opened
        config.toFilterCriteria();
        return config;
    }

    private int getIntValue(CommandLine cmd, String option, int defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    private double getDoubleValue(CommandLine cmd, String opt, double defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(opt);
        return value == null ? defaultValue : ((Number) value).doubleValue();
    }

    /**
     * Calculates possible count of threads to use. If -th set without value, it will be set to number of
     * available processors.
     * @param cmd parsed CommandLine from apache CLI
     * @return number of threads, at least 1
     * @throws ParseException if option -th can't be read
     */
    private int readThreadsCount(CommandLine cmd) throws ParseException {
        int threads = Configuration.DEFAULT_THREADS;
        if (cmd.hasOption("th")) {
            Object value = cmd.getParsedOptionValue("th");
            if (value == null) {
                threads = Runtime.getRuntime().availableProcessors();
            } else {
                threads = ((Number) value).intValue();
            }
        }
        return Math.max(threads, 1);
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @param type report type
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    private Options buildOptions(ReportType type) {
        Options options = new Options();
        options.addOption("h", "help", false, "Print this help information");
        options.addOption("v", "version", false, "Print version information");
        options.addOption("D", "debug", false, "Debug mode. Will print the filters and sample metadata to the log.");
        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription(type == ReportType.FIXHEADER
                        ? "Send output to custom file. Default is <VCF>_fixed.vcf"
                        : "Send output to custom file. Default is STDOUT.")
                .withType(String.class)
                .withLongOpt("output")
                .create('o'));
        if (type == ReportType.FIXHEADER) {
            return options;
        }

        options.addOption("r", "raw", false, "Output as a raw CSV format that can be input into Excel. "
                + "The header output is not in columns as a part of the whole.");
        options.addOption("N", "NOCALL", false, type == ReportType.CNV
                ? "Do not output NOCALL results (Default: On)"
                : "Include NOCALL results in the output (Default: Off)");
        options.addOption(OptionBuilder.withArgName("gene(s)")
                .hasArg(true)
                .withDescription("Print out results for this gene (or comma separated list of genes) only")
                .withType(String.class)
                .withLongOpt("gene")
                .create('g'));
        options.addOption(OptionBuilder.withArgName("csv|tsv|pp")
                .hasArg(true)
                .withDescription("Format to use for output. Can choose 'csv', 'tsv', or pretty print (as 'pp'). "
                        + "Default: pp")
                .withType(String.class)
                .withLongOpt("format")
                .create('f'));
        options.addOption(OptionBuilder.withArgName("INT")
                .hasOptionalArg()
                .withDescription("Threads count to process the files. Default: " + Configuration.DEFAULT_THREADS
                        + ", the number of files if it is less. Without value the number of processors is used.")
                .withType(Number.class)
                .withLongOpt("threads")
                .create("th"));

        switch (type) {
            case CNV:
                options.addOption(OptionBuilder.withArgName("double")
                        .hasArg(true)
                        .withDescription("Only report amplifications with copy number above this value")
                        .withType(Number.class)
                        .withLongOpt("copy_amp")
                        .create());
                options.addOption(OptionBuilder.withArgName("double")
                        .hasArg(true)
                        .withDescription("Only report losses with copy number below this value")
                        .withType(Number.class)
                        .withLongOpt("copy_loss")
                        .create());
                options.addOption(OptionBuilder.withArgName("double")
                        .hasArg(true)
                        .withDescription("Only report amplifications with fold difference above this value. "
                                + "Can not be used with copy number thresholds.")
                        .withType(Number.class)
                        .withLongOpt("fold_amp")
                        .create());
                options.addOption(OptionBuilder.withArgName("double")
                        .hasArg(true)
                        .withDescription("Only report losses with fold difference below this value")
                        .withType(Number.class)
                        .withLongOpt("fold_loss")
                        .create());
                options.addOption(OptionBuilder.withArgName("INT")
                        .hasArg(true)
                        .withDescription("Only report CNVs with at least this number of tiles")
                        .withType(Number.class)
                        .withLongOpt("tiles")
                        .create('t'));
                break;
            case FUSION:
                options.addOption("R", "Ref", false, "Output reference calls and control read counts");
                options.addOption("n", "novel", false, "Output Non-Targeted and Novel fusions");
                options.addOption(OptionBuilder.withArgName("INT")
                        .hasArg(true)
                        .withDescription("Only report fusions with at least this number of reads. Default: "
                                + Configuration.DEFAULT_FUSION_THRESHOLD)
                        .withType(Number.class)
                        .withLongOpt("threshold")
                        .create('t'));
                break;
            case SNV:
                options.addOption(OptionBuilder.withArgName("double")
                        .hasArg(true)
                        .withDescription("Only report variants with VAF at least this value. Default: 0")
                        .withType(Number.class)
                        .withLongOpt("vaf")
                        .create());
                options.addOption(OptionBuilder.withArgName("double")
                        .hasArg(true)
                        .withDescription("Only report variants with alt molecular coverage at least this value. "
                                + "Default: 0")
                        .withType(Number.class)
                        .withLongOpt("mol-cov")
                        .create());
                options.addOption(OptionBuilder.withArgName("path")
                        .hasArg(true)
                        .withDescription("Path to vcfExtractor.pl. Default: vcfExtractor.pl from PATH")
                        .withType(String.class)
                        .withLongOpt("extractor")
                        .create());
                break;
            default:
                break;
        }
        return options;
    }

    private void help(ReportType type, Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setOptionComparator(null);
        PrintWriter writer = new PrintWriter(out);
        formatter.printHelp(writer, 120, "cfdna-report " + type.command + " [options] <VCF_file(s)>",
                type.scriptName + " - " + type.version + "\n" + type.description + "\nOptions:",
                options, 2, 4, "");
        writer.flush();
    }
}
