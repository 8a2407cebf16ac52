package com.astrazeneca.cfdna.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Values of one reportable variant in output column order.
 */
public final class ReportRow {
    private final List<String> values;

    public ReportRow(String... values) {
        this.values = Collections.unmodifiableList(Arrays.asList(values.clone()));
    }

    public ReportRow(List<String> values) {
        this(values.toArray(new String[0]));
    }

    public String get(int column) {
        return values.get(column);
    }

    public List<String> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ReportRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
