package com.astrazeneca.cfdna.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Filtered rows of one sample ready for printing.
 */
public class SampleReport {
    public final SampleIdentity identity;
    public final List<ReportRow> rows;
    public final Map<String, Integer> controls;

    public SampleReport(SampleIdentity identity, List<ReportRow> rows, Map<String, Integer> controls) {
        this.identity = identity;
        this.rows = Collections.unmodifiableList(rows);
        this.controls = controls;
    }

    public SampleReport(SampleIdentity identity, List<ReportRow> rows) {
        this(identity, rows, Collections.emptyMap());
    }
}
