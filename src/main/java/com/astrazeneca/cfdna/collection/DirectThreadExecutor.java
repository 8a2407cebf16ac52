package com.astrazeneca.cfdna.collection;

import java.util.concurrent.Executor;

/**
 * Executor running each task on the calling thread. Used when the report is built with a single thread
 * and inside workers, where the per-file pipeline is already running on a pool thread.
 */
public class DirectThreadExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
