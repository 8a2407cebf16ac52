package com.astrazeneca.cfdna;

import com.astrazeneca.cfdna.annotation.AnnotatorOptions;
import com.astrazeneca.cfdna.annotation.VcfExtractorAnnotator;
import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.printers.OutputFormat;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class Configuration {
    public static final int DEFAULT_THREADS = 48;
    public static final int DEFAULT_FUSION_THRESHOLD = 2;

    public ReportType reportType;
    /**
     * Input VCF files
     */
    public List<File> files = new ArrayList<>();
    /**
     * Genes to report, empty means all genes
     */
    public Set<String> genes = new LinkedHashSet<>(); // -g
    /**
     * Output file, null means stdout
     */
    public String output; // -o
    public OutputFormat format = OutputFormat.PP; // -f
    /**
     * Print all samples as one comma delimited table
     */
    public boolean raw; // -r
    /**
     * For CNV report NOCALL records are excluded with this flag, for fusion and SNV/Indel reports they are included
     */
    public boolean nocall; // -N
    public int threads = DEFAULT_THREADS; // -th
    public boolean debug; // -D

    public double copyAmp; // --copy_amp
    public double copyLoss; // --copy_loss
    public double foldAmp; // --fold_amp
    public double foldLoss; // --fold_loss
    /**
     * Minimum number of tiles for CNV, 0 means no filter
     */
    public int tiles; // -t for cnv

    /**
     * Minimum molecular read count of fusion
     */
    public int threshold = DEFAULT_FUSION_THRESHOLD; // -t for fusion
    /**
     * Show reference calls and control counts
     */
    public boolean ref; // -R
    public boolean novel; // -n

    public double vaf; // --vaf
    public double molCov; // --mol-cov
    /**
     * Path to the variant extractor executable
     */
    public String extractor = VcfExtractorAnnotator.DEFAULT_EXECUTABLE; // --extractor

    public boolean isCnv() {
        return reportType == ReportType.CNV;
    }

    /**
     * Builds immutable filters of the run.
     * @throws com.astrazeneca.cfdna.exception.ConfigurationException if CNV thresholds are in conflict
     */
    public FilterCriteria toFilterCriteria() {
        return FilterCriteria.builder()
                .genes(genes)
                .copyNumber(copyAmp, copyLoss)
                .foldDifference(foldAmp, foldLoss)
                .minTiles(tiles)
                .readCountThreshold(threshold)
                .minVaf(vaf)
                .minAltMolecularCoverage(molCov)
                .includeNoCalls(isCnv() != nocall)
                .includeNovel(novel)
                .includeReferenceCalls(ref)
                .build();
    }

    public AnnotatorOptions toAnnotatorOptions() {
        return new AnnotatorOptions(!nocall, genes);
    }
}
