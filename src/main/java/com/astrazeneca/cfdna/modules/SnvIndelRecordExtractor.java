package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.annotation.AnnotatedVariant;
import com.astrazeneca.cfdna.annotation.AnnotatorOptions;
import com.astrazeneca.cfdna.annotation.SnvIndelSchema;
import com.astrazeneca.cfdna.annotation.VariantAnnotator;
import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.VariantKey;
import com.astrazeneca.cfdna.data.scopedata.VcfLines;
import com.astrazeneca.cfdna.exception.VcfReadException;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.astrazeneca.cfdna.data.Patterns.FILE_UTC_TIME;

/**
 * Extracts SNV and Indel calls of the VCF file through the variant annotator. The basic cfDNA pipeline
 * filters (VAF above LOD, more than one alt molecule, known variant id) are applied to the calls here.
 */
public class SnvIndelRecordExtractor extends RecordExtractor {
    public static final String TIMESTAMP = "Timestamp";
    /**
     * Calls need more alt molecules than this
     */
    public static final double ALT_MOLECULAR_COVERAGE_THRESHOLD = 1;
    public static final String NO_VARIANT_ID = ".";

    public static final Map<String, String> FIELDS;
    static {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String title : SnvIndelSchema.titles()) {
            fields.put(title, SnvIndelSchema.EMPTY_VALUE);
        }
        FIELDS = Collections.unmodifiableMap(fields);
    }

    private final VariantAnnotator annotator;
    private final AnnotatorOptions options;

    public SnvIndelRecordExtractor(VariantAnnotator annotator, AnnotatorOptions options) {
        this.annotator = annotator;
        this.options = options;
    }

    /**
     * @throws VcfReadException if annotator fails on the file
     */
    @Override
    public SampleRecords extract(String source, VcfLines vcf) {
        Map<VariantKey, FieldSet> records = new LinkedHashMap<>();
        try {
            for (AnnotatedVariant variant : annotator.extract(source, options)) {
                if (passesBasicFilters(variant)) {
                    VariantKey key = VariantKey.of(":", variant.position(), variant.ref(), variant.alt());
                    records.put(key, FieldSet.of(FIELDS, variant.toFields()));
                }
            }
        } catch (IOException e) {
            throw new VcfReadException(source, e);
        }
        return new SampleRecords(source, sampleIdentity(vcf), records);
    }

    /**
     * De novo calls (without variant id) are dropped until there is a rule for them.
     */
    static boolean passesBasicFilters(AnnotatedVariant variant) {
        return variant.vaf() > variant.lod()
                && variant.molecularAltCoverage() > ALT_MOLECULAR_COVERAGE_THRESHOLD
                && !NO_VARIANT_ID.equals(variant.variantId());
    }

    /**
     * Sample name is the last column of the column header, timestamp is the value of "fileUTCtime".
     * @return identity or null if the VCF has no column header
     */
    static SampleIdentity sampleIdentity(VcfLines vcf) {
        String name = vcf.sampleColumnName();
        if (name == null) {
            return null;
        }
        String timestamp = null;
        for (String line : vcf.metaLines) {
            String value = findGroup(FILE_UTC_TIME, line);
            if (value != null) {
                timestamp = value;
            }
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(TIMESTAMP, timestamp);
        return new SampleIdentity(name, metadata);
    }
}
