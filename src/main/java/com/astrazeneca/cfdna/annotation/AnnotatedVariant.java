package com.astrazeneca.cfdna.annotation;

import com.astrazeneca.cfdna.annotation.SnvIndelSchema.Column;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One SNV/Indel call as printed by the variant annotator, decoded by {@link SnvIndelSchema}.
 */
public class AnnotatedVariant {
    private final String[] values;

    AnnotatedVariant(String[] values) {
        this.values = values;
    }

    public String get(Column column) {
        return values[column.ordinal()];
    }

    public double getDouble(Column column) {
        return Double.parseDouble(get(column));
    }

    public String position() {
        return get(Column.POSITION);
    }

    public String ref() {
        return get(Column.REF);
    }

    public String alt() {
        return get(Column.ALT);
    }

    public double vaf() {
        return getDouble(Column.VAF);
    }

    public double lod() {
        return getDouble(Column.LOD);
    }

    public double molecularAltCoverage() {
        return getDouble(Column.MOL_ALT_COV);
    }

    public String variantId() {
        return get(Column.VAR_ID);
    }

    /**
     * @return map of column title to value, in column order
     */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Column column : Column.values()) {
            fields.put(column.title, values[column.ordinal()]);
        }
        return fields;
    }
}
