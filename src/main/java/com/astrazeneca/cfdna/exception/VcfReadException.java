package com.astrazeneca.cfdna.exception;


import java.util.Locale;

public class VcfReadException extends RuntimeException {
    public final static String VcfReadExceptionMessage = "Can't read the VCF file \"%s\". The sample of this " +
            "file will be missed in the report.";

    public VcfReadException(String vcf, Throwable e) {
        super(String.format(Locale.US, VcfReadExceptionMessage, vcf), e);
    }
}
