package com.astrazeneca.cfdna.postprocessmodules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.ResultSet;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.SampleReport;
import com.astrazeneca.cfdna.data.VariantKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Base class for preparation of the merged records to the output: records of each sample are sorted by
 * variant key, filtered and projected to report rows.
 */
public abstract class PostProcessModule implements Function<ResultSet, List<SampleReport>> {
    protected final FilterCriteria criteria;

    protected PostProcessModule(FilterCriteria criteria) {
        this.criteria = criteria;
    }

    @Override
    public List<SampleReport> apply(ResultSet results) {
        List<SampleReport> reports = new ArrayList<>();
        for (SampleRecords sample : results.samples().values()) {
            List<ReportRow> rows = new ArrayList<>();
            for (Map.Entry<VariantKey, FieldSet> record : new TreeMap<>(sample.records).entrySet()) {
                if (accept(record.getKey(), record.getValue())) {
                    rows.add(project(record.getKey(), record.getValue()));
                }
            }
            reports.add(new SampleReport(sample.identity, rows, sample.controls));
        }
        return reports;
    }

    /**
     * @return true if the record must be reported
     */
    protected abstract boolean accept(VariantKey key, FieldSet fields);

    /**
     * @return values of the record in the output column order
     */
    protected abstract ReportRow project(VariantKey key, FieldSet fields);
}
