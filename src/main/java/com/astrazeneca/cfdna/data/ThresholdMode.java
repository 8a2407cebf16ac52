package com.astrazeneca.cfdna.data;

import com.astrazeneca.cfdna.exception.ConfigurationException;

/**
 * Kind of numeric threshold used for CNV filtering. Selected once from the configured thresholds.
 */
public enum ThresholdMode {
    NONE,
    FOLD_DIFFERENCE,
    COPY_NUMBER;

    /**
     * A pair of thresholds is used only if both amplification and loss values are set (non-zero).
     * @throws ConfigurationException if both fold difference and copy number pairs are set
     */
    public static ThresholdMode select(double copyAmp, double copyLoss, double foldAmp, double foldLoss) {
        boolean copyPair = copyAmp != 0 && copyLoss != 0;
        boolean foldPair = foldAmp != 0 && foldLoss != 0;
        if (copyPair && foldPair) {
            throw new ConfigurationException(ConfigurationException.ConflictingThresholdsMessage);
        }
        if (foldPair) {
            return FOLD_DIFFERENCE;
        }
        return copyPair ? COPY_NUMBER : NONE;
    }
}
