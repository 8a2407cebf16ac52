package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.exception.VcfReadException;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

import static com.astrazeneca.cfdna.data.Patterns.INFO_HEADER;
import static com.astrazeneca.cfdna.data.Patterns.KEY_VALUE_PAIR;
import static com.astrazeneca.cfdna.data.Patterns.SPACE_QUOTE_END;

/**
 * Rewrites the malformed INFO lines of cfDNA fusion VCF header so that the file can be read by standard
 * VCF tools. All other lines are copied as is.
 */
public class VcfHeaderFixer {
    private static final Log LOG = Log.getInstance(VcfHeaderFixer.class);

    public static final List<String> MALFORMED_FIELDS = Collections.unmodifiableList(Arrays.asList(
            "MOL_RATIO_TO_WILD_TYPE", "NORM_COUNT_WITHIN_GENE", "RATIO_TO_WILD_TYPE", "NORM_MOL_COUNT_WITHIN_GENE"));

    /**
     * Copies the VCF file to the output fixing its header.
     * @param vcf input VCF file
     * @param out output for the fixed file
     * @throws VcfReadException if the file can't be read
     */
    public void fix(File vcf, PrintStream out) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(vcf, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new VcfReadException(vcf.getPath(), e);
        }
        int fixed = 0;
        for (String line : lines) {
            String fixedLine = fixHeaderLine(line);
            if (!fixedLine.equals(line)) {
                fixed++;
            }
            out.println(fixedLine);
        }
        LOG.info("Fixed ", fixed, " header lines of ", vcf.getPath());
    }

    /**
     * @param line line of VCF file
     * @return fixed line if it is a header line with one of malformed fields, otherwise the same line
     */
    public static String fixHeaderLine(String line) {
        if (!line.startsWith("#") || !isMalformed(line)) {
            return line;
        }
        Matcher info = INFO_HEADER.matcher(line);
        String content = info.find() ? info.replaceFirst("$1") : line;

        List<String> pairs = new ArrayList<>();
        Matcher pair = KEY_VALUE_PAIR.matcher(content);
        while (pair.find()) {
            pairs.add(pair.group(1));
        }
        if (pairs.isEmpty()) {
            return line;
        }
        int last = pairs.size() - 1;
        pairs.set(last, SPACE_QUOTE_END.matcher(pairs.get(last)).replaceFirst(".\""));
        return "##INFO=<" + String.join(",", pairs) + ">";
    }

    private static boolean isMalformed(String line) {
        for (String field : MALFORMED_FIELDS) {
            if (line.contains(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param vcf path of input file
     * @return path of output file used when no output is set: ".vcf" is replaced with "_fixed.vcf"
     */
    public static String defaultOutput(String vcf) {
        String output = vcf.replaceFirst("\\.vcf", "_fixed.vcf");
        return output.equals(vcf) ? vcf + "_fixed.vcf" : output;
    }
}
