package com.astrazeneca.cfdna.data;

import com.astrazeneca.cfdna.collection.VersionComparator;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Identity of a variant record inside one sample: source fields joined with a delimiter, e.g.
 * "chr7:55086714:EGFR:G" for CNV or "EML4-ALK|E6aA20|COSF478" for a fusion. Ordered by version comparison.
 */
public final class VariantKey implements Comparable<VariantKey> {
    private final List<String> parts;
    private final String id;

    private VariantKey(String delimiter, String... parts) {
        this.parts = Collections.unmodifiableList(Arrays.asList(parts.clone()));
        this.id = String.join(delimiter, parts);
    }

    public static VariantKey of(String delimiter, String... parts) {
        return new VariantKey(delimiter, parts);
    }

    public String part(int index) {
        return parts.get(index);
    }

    public List<String> parts() {
        return parts;
    }

    public String id() {
        return id;
    }

    @Override
    public int compareTo(VariantKey other) {
        return VersionComparator.INSTANCE.compare(id, other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((VariantKey) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
