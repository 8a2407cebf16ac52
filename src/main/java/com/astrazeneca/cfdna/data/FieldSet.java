package com.astrazeneca.cfdna.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named field values of one variant record. Every field set of a record type carries the whole vocabulary
 * of that type: the values absent in the source are replaced by the vocabulary defaults.
 */
public final class FieldSet {
    private final Map<String, String> fields;

    private FieldSet(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Creates field set restricted to the vocabulary.
     * @param vocabulary ordered field names with the default value for each
     * @param values parsed values, keys out of vocabulary are ignored
     * @return field set with a value for each field of vocabulary
     */
    public static FieldSet of(Map<String, String> vocabulary, Map<String, String> values) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : vocabulary.entrySet()) {
            String value = values.get(entry.getKey());
            fields.put(entry.getKey(), value == null || value.isEmpty() ? entry.getValue() : value);
        }
        return new FieldSet(fields);
    }

    public String get(String name) {
        String value = fields.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Field " + name + " is not a part of this record type");
        }
        return value;
    }

    /**
     * @param name field name
     * @return numeric value of the field
     * @throws NumberFormatException if the value is not a number
     */
    public double getDouble(String name) {
        return Double.parseDouble(get(name));
    }

    public Set<String> names() {
        return fields.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((FieldSet) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
