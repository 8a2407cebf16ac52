package com.astrazeneca.cfdna.annotation;

import java.io.IOException;
import java.util.List;

/**
 * External utility which reads the VCF file and prints the annotated SNV/Indel calls of it.
 */
public interface VariantAnnotator {

    /**
     * Precondition for the use of annotator: the utility is available and is new enough.
     * @throws com.astrazeneca.cfdna.exception.ExternalToolException if the utility is missing or too old
     */
    void checkVersion();

    /**
     * @param vcf path to VCF file
     * @param options pre-filters for the annotator
     * @return decoded calls, lines which can't be decoded are skipped
     * @throws IOException if annotator fails on the file
     */
    List<AnnotatedVariant> extract(String vcf, AnnotatorOptions options) throws IOException;
}
