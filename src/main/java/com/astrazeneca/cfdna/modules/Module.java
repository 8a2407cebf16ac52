package com.astrazeneca.cfdna.modules;

import com.astrazeneca.cfdna.data.scopedata.Scope;

/**
 * Functional interface for all Modules of the reports (they can be the steps of per-file pipeline in
 * AbstractReportMode).
 * @param <T> means input data needed on step (module)
 * @param <R> means output data that step (module) produces
 */
@FunctionalInterface
public interface Module<T, R> {

    Scope<R> process(Scope<T> scope);
}
