package com.astrazeneca.cfdna.annotation;

import com.astrazeneca.cfdna.collection.VersionComparator;
import com.astrazeneca.cfdna.exception.ExternalToolException;
import htsjdk.samtools.util.Log;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import static com.astrazeneca.cfdna.data.Patterns.EXTRACTOR_VERSION;

/**
 * Variant annotator implemented by vcfExtractor.pl utility (https://github.com/drmrgd/biofx_utils).
 * The utility is started for each VCF file as {@code vcfExtractor.pl -[N]nac [-g genes] <vcf>}, only the lines
 * starting with "chr" are decoded.
 */
public class VcfExtractorAnnotator implements VariantAnnotator {
    private static final Log LOG = Log.getInstance(VcfExtractorAnnotator.class);

    public static final String DEFAULT_EXECUTABLE = "vcfExtractor.pl";
    /**
     * First version of vcfExtractor which can handle cfDNA data
     */
    public static final String REQUIRED_VERSION = "7.9";

    private final String executable;

    public VcfExtractorAnnotator(String executable) {
        this.executable = executable;
    }

    public VcfExtractorAnnotator() {
        this(DEFAULT_EXECUTABLE);
    }

    @Override
    public void checkVersion() {
        List<String> versionOutput;
        try (VcfExtractorProcess process = new VcfExtractorProcess(executable, "-v")) {
            versionOutput = process.readAll();
        } catch (IOException e) {
            throw new ExternalToolException(executable, e);
        }
        String version = parseVersion(versionOutput);
        if (version == null) {
            throw new ExternalToolException("Can't find the version of '" + executable + "' in its output.");
        }
        requireVersion(version);
        LOG.debug("Using ", executable, " version ", version);
    }

    @Override
    public List<AnnotatedVariant> extract(String vcf, AnnotatorOptions options) throws IOException {
        List<AnnotatedVariant> variants = new ArrayList<>();
        try (VcfExtractorProcess process = new VcfExtractorProcess(executable, arguments(vcf, options))) {
            String line;
            while ((line = process.read()) != null) {
                if (!line.startsWith("chr")) {
                    continue;
                }
                AnnotatedVariant variant = SnvIndelSchema.decode(line);
                if (variant != null) {
                    variants.add(variant);
                }
            }
        }
        return variants;
    }

    /**
     * Builds vcfExtractor arguments: reference calls removed, annotation and cfDNA mode on, NOCALLs removed
     * if requested and output restricted to genes if they are set.
     */
    static String[] arguments(String vcf, AnnotatorOptions options) {
        List<String> args = new ArrayList<>();
        args.add(options.excludeNoCalls ? "-Nnac" : "-nac");
        if (!options.genes.isEmpty()) {
            args.add("-g");
            args.add(String.join(",", options.genes));
        }
        args.add(vcf);
        return args.toArray(new String[0]);
    }

    /**
     * Finds version like "v8.1.2_031618" in the output and returns major and minor parts of it.
     * @param versionOutput lines of vcfExtractor -v
     * @return version as "major.minor" or null if not found
     */
    static String parseVersion(List<String> versionOutput) {
        for (String line : versionOutput) {
            Matcher matcher = EXTRACTOR_VERSION.matcher(line);
            if (matcher.find()) {
                return matcher.group(1) + "." + matcher.group(2);
            }
        }
        return null;
    }

    static void requireVersion(String version) {
        if (VersionComparator.INSTANCE.compare(version, REQUIRED_VERSION) < 0) {
            throw new ExternalToolException(DEFAULT_EXECUTABLE, version, REQUIRED_VERSION);
        }
    }
}
