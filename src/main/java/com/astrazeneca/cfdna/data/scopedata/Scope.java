package com.astrazeneca.cfdna.data.scopedata;

/**
 * Common scope of data passed between the steps of the per-file pipeline.
 * @param <T> data of current step of pipeline
 */
public class Scope<T> {

    /**
     * Path of the input file processed by the pipeline
     */
    public final String source;

    public final T data;

    public Scope(String source, T data) {
        this.source = source;
        this.data = data;
    }

    public Scope(Scope<?> inheritableScope, T data) {
        this(inheritableScope.source, data);
    }
}
