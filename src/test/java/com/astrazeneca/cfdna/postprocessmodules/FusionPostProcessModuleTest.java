package com.astrazeneca.cfdna.postprocessmodules;

import com.astrazeneca.cfdna.data.FieldSet;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ReportRow;
import com.astrazeneca.cfdna.data.ResultSet;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleRecords;
import com.astrazeneca.cfdna.data.SampleReport;
import com.astrazeneca.cfdna.data.VariantKey;
import com.astrazeneca.cfdna.modules.FusionRecordExtractor;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.testng.Assert.assertEquals;

public class FusionPostProcessModuleTest {

    private static FieldSet fusion(int count, String driver, String filter, String id) {
        Map<String, String> values = new HashMap<>();
        values.put("COUNT", String.valueOf(count));
        values.put("DRIVER", driver);
        values.put("PARTNER", "EML4");
        values.put("FILTER", filter);
        values.put("ID", id);
        return FieldSet.of(FusionRecordExtractor.FIELDS, values);
    }

    private static List<SampleReport> apply(FilterCriteria criteria, FieldSet fields) {
        Map<VariantKey, FieldSet> records = new LinkedHashMap<>();
        records.put(VariantKey.of("|", "EML4-ALK", "E13A20", fields.get("ID")), fields);
        Map<String, Integer> controls = Collections.singletonMap("GAPDH", 2500);
        SampleRecords sample = new SampleRecords("s.vcf", SampleIdentity.ofName("s"), records, controls);
        return new FusionPostProcessModule(criteria).apply(ResultSet.merge(Collections.singletonList(sample)));
    }

    private static FilterCriteria.Builder defaults() {
        return FilterCriteria.builder().readCountThreshold(2);
    }

    @DataProvider(name = "fusions")
    public Object[][] fusions() {
        return new Object[][] {
                {defaults().build(), fusion(85, "ALK", "PASS", "COSF408"), 1},
                {defaults().build(), fusion(1, "ALK", "PASS", "COSF408"), 0},
                {defaults().build(), fusion(2, "ALK", "PASS", "COSF408"), 1},
                {defaults().build(), fusion(0, "ALK", "PASS", "COSF408"), 0},
                {defaults().readCountThreshold(0).includeReferenceCalls(true).build(), fusion(0, "ALK", "PASS", "-"), 1},
                {defaults().build(), fusion(50, "ALK", "FAIL", "-"), 0},
                {defaults().includeReferenceCalls(true).build(), fusion(50, "ALK", "FAIL", "-"), 1},
                {defaults().build(), fusion(50, "ALK", "NOCALL", "-"), 0},
                {defaults().includeNoCalls(true).build(), fusion(50, "ALK", "NOCALL", "-"), 1},
                {defaults().build(), fusion(50, "ALK", "PASS", "Novel"), 0},
                {defaults().build(), fusion(50, "ALK", "PASS", "Non-Targeted"), 0},
                {defaults().includeNovel(true).build(), fusion(50, "ALK", "PASS", "Novel"), 1},
                {defaults().genes(Collections.singleton("RET")).build(), fusion(50, "ALK", "PASS", "-"), 0},
                {defaults().genes(Collections.singleton("ALK")).build(), fusion(50, "ALK", "PASS", "-"), 1},
        };
    }

    @Test(dataProvider = "fusions")
    public void filtersFusions(FilterCriteria criteria, FieldSet fields, int expected) {
        assertEquals(apply(criteria, fields).get(0).rows.size(), expected);
    }

    @Test
    public void projectsFusionRowAndKeepsControls() {
        SampleReport report = apply(defaults().build(), fusion(85, "ALK", "PASS", "COSF408")).get(0);

        assertEquals(report.rows.get(0), new ReportRow("EML4-ALK.E13A20", "COSF408", "85", "ALK", "EML4"));
        assertEquals(report.controls, Collections.singletonMap("GAPDH", 2500));
    }
}
