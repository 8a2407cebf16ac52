package com.astrazeneca.cfdna.annotation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.cfdna.data.Patterns.WHITESPACE;

/**
 * Column layout of the SNV/Indel lines printed by the variant annotator. The first 15 columns are required,
 * the oncomine classes are printed only when annotation data is available.
 */
public final class SnvIndelSchema {

    public enum Column {
        POSITION("Chr:Position", false),
        REF("Ref", false),
        ALT("Alt", false),
        VAF("VAF", true),
        LOD("LOD", true),
        AMP_COV("AmpCov", true),
        MOL_REF_COV("MolRefCov", true),
        MOL_ALT_COV("MolAltCov", true),
        VAR_ID("VarID", false),
        GENE("Gene", false),
        TRANSCRIPT("Transcript", false),
        CDS("CDS", false),
        AA("AA", false),
        LOCATION("Location", false),
        FUNCTION("Function", false),
        GENE_CLASS("oncomineGeneClass", false),
        VARIANT_CLASS("oncomineVariantClass", false);

        public final String title;
        final boolean numeric;

        Column(String title, boolean numeric) {
            this.title = title;
            this.numeric = numeric;
        }
    }

    public static final int REQUIRED_COLUMNS = Column.FUNCTION.ordinal() + 1;
    public static final String EMPTY_VALUE = ".";

    private SnvIndelSchema() {
    }

    /**
     * @return titles of all columns in order
     */
    public static List<String> titles() {
        List<String> titles = new ArrayList<>();
        for (Column column : Column.values()) {
            titles.add(column.title);
        }
        return Collections.unmodifiableList(titles);
    }

    /**
     * Decodes one line of annotator output. Missing optional columns get "." value.
     * @param line whitespace separated line
     * @return decoded variant or null if line has less than required columns or a numeric column is not a number
     */
    public static AnnotatedVariant decode(String line) {
        String[] columns = WHITESPACE.split(line.trim());
        if (columns.length < REQUIRED_COLUMNS) {
            return null;
        }
        Column[] schema = Column.values();
        String[] values = new String[schema.length];
        Arrays.fill(values, EMPTY_VALUE);
        System.arraycopy(columns, 0, values, 0, Math.min(columns.length, schema.length));

        for (Column column : schema) {
            if (column.numeric && !isNumber(values[column.ordinal()])) {
                return null;
            }
        }
        return new AnnotatedVariant(values);
    }

    private static boolean isNumber(String value) {
        try {
            Double.parseDouble(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
