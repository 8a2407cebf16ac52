package com.astrazeneca.cfdna.data;

import htsjdk.samtools.util.Log;

import java.io.File;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Records of all samples keyed by sample identity. Created once by merge of worker results and read-only after.
 * Samples are iterated in version order of their keys.
 */
public class ResultSet {
    private static final Log LOG = Log.getInstance(ResultSet.class);

    private final SortedMap<SampleIdentity, SampleRecords> samples;

    private ResultSet(SortedMap<SampleIdentity, SampleRecords> samples) {
        this.samples = Collections.unmodifiableSortedMap(samples);
    }

    /**
     * Folds the worker results to one result set. Results without sample identity get the base name of their
     * file as identity. If two results have the same identity, the later one replaces the earlier one
     * and the collision is reported to the log.
     * @param fragments worker results in order of worker completion
     * @return merged result set
     */
    public static ResultSet merge(Collection<SampleRecords> fragments) {
        SortedMap<SampleIdentity, SampleRecords> samples = new TreeMap<>();
        for (SampleRecords fragment : fragments) {
            SampleRecords records = fragment.identity == null
                    ? fragment.withIdentity(SampleIdentity.ofName(new File(fragment.source).getName()))
                    : fragment;
            SampleRecords previous = samples.put(records.identity, records);
            if (previous != null) {
                LOG.warn("Sample ", records.identity.key(), " from ", records.source,
                        " has the same identity as the sample from ", previous.source,
                        ". Only the results from ", records.source, " will be reported.");
            }
        }
        return new ResultSet(samples);
    }

    public SortedMap<SampleIdentity, SampleRecords> samples() {
        return samples;
    }

    public SampleRecords get(SampleIdentity identity) {
        return samples.get(identity);
    }

    public int size() {
        return samples.size();
    }
}
