package com.astrazeneca.cfdna.data;

import com.astrazeneca.cfdna.collection.VersionComparator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity of one input file output: sample name and the metadata found in the file (gender, MAPD and
 * cellularity for CNV, timestamp for SNV/Indel). Used as the top-level key of the report.
 */
public final class SampleIdentity implements Comparable<SampleIdentity> {
    public static final String MISSING = "NA";

    private final String name;
    private final Map<String, String> metadata;
    private final String key;

    public SampleIdentity(String name, Map<String, String> metadata) {
        this.name = name;
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            values.put(entry.getKey(), entry.getValue() == null ? MISSING : entry.getValue());
        }
        this.metadata = Collections.unmodifiableMap(values);

        List<String> parts = new ArrayList<>();
        parts.add(name);
        parts.addAll(this.metadata.values());
        this.key = String.join(":", parts);
    }

    public static SampleIdentity ofName(String name) {
        return new SampleIdentity(name, Collections.emptyMap());
    }

    public String name() {
        return name;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public String metadata(String field) {
        String value = metadata.get(field);
        return value == null ? MISSING : value;
    }

    /**
     * @return name and metadata values joined by colon, e.g. "Sample1:Female:0.12:0.3"
     */
    public String key() {
        return key;
    }

    @Override
    public int compareTo(SampleIdentity other) {
        return VersionComparator.INSTANCE.compare(key, other.key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return key.equals(((SampleIdentity) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
