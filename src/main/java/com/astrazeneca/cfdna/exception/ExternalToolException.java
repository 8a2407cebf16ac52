package com.astrazeneca.cfdna.exception;


import java.util.Locale;

public class ExternalToolException extends RuntimeException {
    public final static String ToolMissedMessage = "'%s' is not in your path. Please install this required " +
            "utility from https://github.com/drmrgd/biofx_utils and try again.";
    public final static String ToolTooOldMessage = "%s version (v%s) is too old and does not have the necessary " +
            "components to run cfDNA data analysis. Please update your version to v%s or later from: " +
            "https://github.com/drmrgd/biofx_utils.";

    public ExternalToolException(String tool, Throwable e) {
        super(String.format(Locale.US, ToolMissedMessage, tool), e);
    }

    public ExternalToolException(String tool, String version, String requiredVersion) {
        super(String.format(Locale.US, ToolTooOldMessage, tool, version, requiredVersion));
    }

    public ExternalToolException(String message) {
        super(message);
    }
}
