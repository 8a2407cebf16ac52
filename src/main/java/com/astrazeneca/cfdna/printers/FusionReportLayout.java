package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.collection.VersionComparator;
import com.astrazeneca.cfdna.data.SampleIdentity;
import com.astrazeneca.cfdna.data.SampleReport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public class FusionReportLayout extends ReportLayout {
    private static final List<String> HEADER = Collections.unmodifiableList(Arrays.asList(
            "Fusion", "ID", "Read_Count", "Driver_Gene", "Partner_Gene"));

    private final Set<String> genes;
    private final boolean showControls;

    /**
     * @param genes genes filter, printed in the sample banner
     * @param showControls print read counts of controls after the fusions
     */
    public FusionReportLayout(Set<String> genes, boolean showControls) {
        this.genes = genes;
        this.showControls = showControls;
    }

    @Override
    public List<String> header() {
        return HEADER;
    }

    /**
     * Fusion name column is sized by the longest fusion name of the sample.
     */
    @Override
    public int[] columnWidths(List<SampleReport> reports, SampleReport sample) {
        int fusionWidth = longestValueWidth(Collections.singletonList(sample), 0, HEADER.get(0).length() + 2);
        return new int[] {fusionWidth, 12, 12, 15, 15};
    }

    @Override
    public String banner(SampleReport sample) {
        String geneList = genes.isEmpty() ? "" : String.join(",", genes) + " ";
        return "::: " + geneList + "Fusions in " + sample.identity.name() + " :::";
    }

    @Override
    public String emptyMarker() {
        return "\t\t\t<<< No Fusions Detected >>>";
    }

    @Override
    public List<String> rawSampleHeader() {
        return Collections.singletonList("Sample");
    }

    @Override
    public List<String> rawSampleValues(SampleIdentity identity) {
        return Collections.singletonList(identity.name());
    }

    @Override
    public List<String> trailer(SampleReport sample) {
        if (!showControls || sample.controls.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, Integer> sorted = new TreeMap<>(VersionComparator.INSTANCE);
        sorted.putAll(sample.controls);
        List<String> lines = new ArrayList<>();
        lines.add("Controls:");
        for (Map.Entry<String, Integer> control : sorted.entrySet()) {
            lines.add(String.format("    %-20s %d", control.getKey(), control.getValue()));
        }
        return lines;
    }
}
