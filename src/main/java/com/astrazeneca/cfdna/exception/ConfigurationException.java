package com.astrazeneca.cfdna.exception;


/**
 * Fatal configuration problem found before any input file is processed: wrong option value, conflicting
 * filters, missing input files.
 */
public class ConfigurationException extends RuntimeException {
    public final static String ConflictingThresholdsMessage = "You can not use both the fold difference and copy " +
            "number threshold for filtering. Please use just one or the other.";
    public final static String NoInputFilesMessage = "No VCF files passed to the report!";
    public final static String SingleOutputForManyFilesMessage = "Output file can be set for a single VCF only. " +
            "Run without -o to write <VCF>_fixed.vcf next to each input.";

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable e) {
        super(message, e);
    }
}
