package com.astrazeneca.cfdna.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one worker: records of one input file keyed by variant, the sample identity and, for fusion
 * files, the read counts of control probes which are kept apart from the records.
 */
public class SampleRecords {
    /**
     * Path of the file the records were read from
     */
    public final String source;
    /**
     * Identity found in the file content. Null if the file has no sample name.
     */
    public final SampleIdentity identity;
    public final Map<VariantKey, FieldSet> records;
    public final Map<String, Integer> controls;

    public SampleRecords(String source, SampleIdentity identity, Map<VariantKey, FieldSet> records,
                         Map<String, Integer> controls) {
        this.source = source;
        this.identity = identity;
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.controls = Collections.unmodifiableMap(new LinkedHashMap<>(controls));
    }

    public SampleRecords(String source, SampleIdentity identity, Map<VariantKey, FieldSet> records) {
        this(source, identity, records, Collections.emptyMap());
    }

    public SampleRecords withIdentity(SampleIdentity sampleIdentity) {
        return new SampleRecords(source, sampleIdentity, records, controls);
    }
}
