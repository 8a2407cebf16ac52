package com.astrazeneca.cfdna.postprocessmodules;

import com.astrazeneca.cfdna.data.FilterCriteria;
import com.astrazeneca.cfdna.data.ThresholdMode;

/**
 * Numeric filter of CNV records. The p-value gate is checked first and can't be overridden, then the record
 * is checked against the threshold pair of the selected mode.
 */
public final class CnvThresholdFilter {
    private final ThresholdMode mode;
    private final double amp;
    private final double loss;

    public CnvThresholdFilter(FilterCriteria criteria) {
        this.mode = criteria.thresholdMode;
        switch (mode) {
            case FOLD_DIFFERENCE:
                amp = criteria.foldAmp;
                loss = criteria.foldLoss;
                break;
            case COPY_NUMBER:
                amp = criteria.copyAmp;
                loss = criteria.copyLoss;
                break;
            default:
                amp = 0;
                loss = 0;
        }
    }

    /**
     * @param pValue p-value of the CNV call
     * @param copyNumber CN value
     * @param foldDifference FD value
     * @return true if the CNV passes the filter
     */
    public boolean accept(double pValue, double copyNumber, double foldDifference) {
        if (pValue > FilterCriteria.MAX_CNV_PVALUE) {
            return false;
        }
        switch (mode) {
            case FOLD_DIFFERENCE:
                return foldDifference > amp || foldDifference < loss;
            case COPY_NUMBER:
                return copyNumber > amp || copyNumber < loss;
            default:
                return true;
        }
    }
}
