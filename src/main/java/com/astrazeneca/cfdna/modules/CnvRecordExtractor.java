package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.VariantKey;
import com.astrazeneca.cfdna.data.scopedata.VcfLines;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.astrazeneca.cfdna.data.Patterns.*;

/**
 * Extracts {@code <CNV>} records of the cfDNA CNV VCF. Key of record is CHROM:POS:ID:REF (ID column holds
 * the gene), fields are taken from INFO plus the copy number from the sample column.
 */
public class CnvRecordExtractor extends RecordExtractor {
    public static final String CNV_ALLELE = "<CNV>";

    public static final String GENDER = "Gender";
    public static final String MAPD_FIELD = "MAPD";
    public static final String CELLULARITY_FIELD = "Cellularity";

    /**
     * CNV fields with their default values
     */
    public static final Map<String, String> FIELDS;
    static {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("END", "0");
        fields.put("LEN", "0");
        fields.put("NUMTILES", "0");
        fields.put("CN", "0");
        fields.put("FD", "0");
        fields.put("HS", "No");
        fields.put("FUNC", ".");
        fields.put("PVAL", "0");
        fields.put("RMMDP", "0");
        fields.put("MMDP", "0");
        fields.put("SD", "NA");
        fields.put("FILTER", ".");
        FIELDS = Collections.unmodifiableMap(fields);
    }

    private static final int SAMPLE_COLUMN = 9;

    @Override
    public SampleRecords extract(String source, VcfLines vcf) {
        Map<VariantKey, FieldSet> records = new LinkedHashMap<>();
        for (String line : vcf.dataLines) {
            String[] columns = WHITESPACE.split(line.trim());
            if (columns.length <= SAMPLE_COLUMN || !CNV_ALLELE.equals(columns[4])) {
                continue;
            }
            VariantKey key = VariantKey.of(":", columns[0], columns[1], columns[2], columns[3]);

            Map<String, String> values = parseInfo(columns[7]);
            String copyNumber = findGroup(LAST_COLON_FIELD, columns[SAMPLE_COLUMN]);
            if (copyNumber != null) {
                values.put("CN", copyNumber);
            }
            values.put("FILTER", columns[6]);
            records.put(key, FieldSet.of(FIELDS, values));
        }
        return new SampleRecords(source, sampleIdentity(vcf), records);
    }

    /**
     * Splits INFO field to key-value map. Hotspot flag "HS" is turned to "HS=Yes" and "SD" without value
     * gets "NA" value before split.
     * @param info INFO column of CNV record
     * @return map of INFO values
     */
    static Map<String, String> parseInfo(String info) {
        String normalized = HS_FLAG.matcher(info).replaceAll("$1HS=Yes");
        normalized = SD_NO_VALUE.matcher(normalized).replaceAll("$1SD=NA");

        Map<String, String> values = new HashMap<>();
        for (String token : normalized.split(";")) {
            String[] pair = token.split("=", 2);
            if (pair.length == 2) {
                values.put(pair[0], pair[1]);
            }
        }
        return values;
    }

    /**
     * Sample name is the last column of the column header, gender, MAPD and cellularity are found in the
     * meta header lines (the last found value wins).
     * @return identity or null if the VCF has no column header
     */
    static SampleIdentity sampleIdentity(VcfLines vcf) {
        String name = vcf.sampleColumnName();
        if (name == null) {
            return null;
        }
        String gender = null;
        String mapd = null;
        String cellularity = null;
        for (String line : vcf.metaLines) {
            String value;
            if ((value = findGroup(SAMPLE_GENDER, line)) != null) {
                gender = value;
            }
            if ((value = findGroup(ASSUMED_GENDER, line)) != null) {
                gender = "m".equals(value) ? "Male" : "Female";
            }
            if ((value = findGroup(MAPD, line)) != null) {
                mapd = value;
            }
            if ((value = findGroup(CELLULARITY, line)) != null) {
                cellularity = value.trim();
            }
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(GENDER, gender);
        metadata.put(MAPD_FIELD, mapd);
        metadata.put(CELLULARITY_FIELD, cellularity);
        return new SampleIdentity(name, metadata);
    }
}
