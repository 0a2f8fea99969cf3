package com.phillippitts.voiceforge.testutil;

import java.util.concurrent.Executor;

/**
 * Synchronous executor for predictable test execution.
 *
 * <p>Runs tasks immediately on the calling thread instead of submitting
 * to a thread pool.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
