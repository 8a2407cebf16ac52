package com.astrazeneca.cfdna.annotation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Pre-filters requested from the variant annotator.
 */
public class AnnotatorOptions {
    public final boolean excludeNoCalls;
    /**
     * Genes to restrict the output to, empty for all genes
     */
    public final Set<String> genes;

    public AnnotatorOptions(boolean excludeNoCalls, Set<String> genes) {
        this.excludeNoCalls = excludeNoCalls;
        this.genes = Collections.unmodifiableSet(new LinkedHashSet<>(genes));
    }
}
