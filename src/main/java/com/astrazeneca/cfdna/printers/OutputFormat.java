package com.astrazeneca.cfdna.printers;

import com.astrazeneca.cfdna.exception.ConfigurationException;

/**
 * Output formats which can be chosen from command line. Pretty print has no delimiter, columns are aligned.
 */
public enum OutputFormat {
    CSV("csv", ","),
    TSV("tsv", "\t"),
    PP("pp", "");

    public final String option;
    public final String delimiter;

    OutputFormat(String option, String delimiter) {
        this.option = option;
        this.delimiter = delimiter;
    }

    /**
     * @param option value of --format option
     * @throws ConfigurationException if there is no such format
     */
    public static OutputFormat fromOption(String option) {
        for (OutputFormat format : values()) {
            if (format.option.equals(option)) {
                return format;
            }
        }
        throw new ConfigurationException("'" + option + "' is not a valid option as a delimiter!");
    }
}
