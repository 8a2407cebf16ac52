package com.astrazeneca.cfdna.data;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Filters of the run. Built once from the configuration and never changed.
 */
public final class FilterCriteria {
    /**
     * CNV records with p-value above this are never reported
     */
    public static final double MAX_CNV_PVALUE = 0.00005;

    /**
     * Genes to report, empty means all genes
     */
    public final Set<String> genes;
    public final ThresholdMode thresholdMode;
    public final double copyAmp;
    public final double copyLoss;
    public final double foldAmp;
    public final double foldLoss;
    /**
     * Minimum number of tiles for CNV, 0 means no filtering
     */
    public final int minTiles;
    /**
     * Minimum molecular read count for fusions
     */
    public final int readCountThreshold;
    public final double minVaf;
    public final double minAltMolecularCoverage;
    public final boolean includeNoCalls;
    /**
     * Include Non-Targeted and Novel fusions
     */
    public final boolean includeNovel;
    /**
     * Include reference (zero count or FAIL) fusion calls
     */
    public final boolean includeReferenceCalls;

    private FilterCriteria(Builder builder) {
        this.genes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.genes));
        this.thresholdMode = ThresholdMode.select(builder.copyAmp, builder.copyLoss, builder.foldAmp, builder.foldLoss);
        this.copyAmp = builder.copyAmp;
        this.copyLoss = builder.copyLoss;
        this.foldAmp = builder.foldAmp;
        this.foldLoss = builder.foldLoss;
        this.minTiles = builder.minTiles;
        this.readCountThreshold = builder.readCountThreshold;
        this.minVaf = builder.minVaf;
        this.minAltMolecularCoverage = builder.minAltMolecularCoverage;
        this.includeNoCalls = builder.includeNoCalls;
        this.includeNovel = builder.includeNovel;
        this.includeReferenceCalls = builder.includeReferenceCalls;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean acceptsGene(String gene) {
        return genes.isEmpty() || genes.contains(gene);
    }

    @Override
    public String toString() {
        return "genes=" + (genes.isEmpty() ? "undef" : String.join(",", genes))
                + ", mode=" + thresholdMode
                + ", copy_amp=" + copyAmp + ", copy_loss=" + copyLoss
                + ", fold_amp=" + foldAmp + ", fold_loss=" + foldLoss
                + ", tiles=" + minTiles + ", threshold=" + readCountThreshold
                + ", vaf=" + minVaf + ", mol_cov=" + minAltMolecularCoverage
                + ", nocall=" + includeNoCalls + ", novel=" + includeNovel + ", ref=" + includeReferenceCalls;
    }

    public static class Builder {
        private Set<String> genes = Collections.emptySet();
        private double copyAmp;
        private double copyLoss;
        private double foldAmp;
        private double foldLoss;
        private int minTiles;
        private int readCountThreshold;
        private double minVaf;
        private double minAltMolecularCoverage;
        private boolean includeNoCalls;
        private boolean includeNovel;
        private boolean includeReferenceCalls;

        public Builder genes(Set<String> genes) {
            this.genes = genes;
            return this;
        }

        public Builder copyNumber(double amp, double loss) {
            this.copyAmp = amp;
            this.copyLoss = loss;
            return this;
        }

        public Builder foldDifference(double amp, double loss) {
            this.foldAmp = amp;
            this.foldLoss = loss;
            return this;
        }

        public Builder minTiles(int minTiles) {
            this.minTiles = minTiles;
            return this;
        }

        public Builder readCountThreshold(int readCountThreshold) {
            this.readCountThreshold = readCountThreshold;
            return this;
        }

        public Builder minVaf(double minVaf) {
            this.minVaf = minVaf;
            return this;
        }

        public Builder minAltMolecularCoverage(double minAltMolecularCoverage) {
            this.minAltMolecularCoverage = minAltMolecularCoverage;
            return this;
        }

        public Builder includeNoCalls(boolean includeNoCalls) {
            this.includeNoCalls = includeNoCalls;
            return this;
        }

        public Builder includeNovel(boolean includeNovel) {
            this.includeNovel = includeNovel;
            return this;
        }

        public Builder includeReferenceCalls(boolean includeReferenceCalls) {
            this.includeReferenceCalls = includeReferenceCalls;
            return this;
        }

        /**
         * @throws com.astrazeneca.cfdna.exception.ConfigurationException if thresholds are in conflict
         */
        public FilterCriteria build() {
            return new FilterCriteria(this);
        }
    }
}
