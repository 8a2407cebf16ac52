package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.scopedata.Scope;
import com.astrazeneca.cfdna.data.scopedata.VcfLines;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Step of the per-file pipeline which extracts the records of one variant category and the sample identity
 * from the lines of VCF file. Lines which are not records of the category or can't be parsed are skipped.
 */
public abstract class RecordExtractor implements Module<VcfLines, SampleRecords> {

    @Override
    public Scope<SampleRecords> process(Scope<VcfLines> scope) {
        return new Scope<>(scope, extract(scope.source, scope.data));
    }

    /**
     * @param source path of the VCF file
     * @param vcf lines of the VCF file
     * @return records of the file with the identity of its sample
     */
    public abstract SampleRecords extract(String source, VcfLines vcf);

    /**
     * Finds the value of the pattern first group in the line.
     * @return value or null if pattern isn't found
     */
    static String findGroup(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? matcher.group(1) : null;
    }
}
