package com.phillippitts.voiceforge.service.gateway;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serial executor over a shared thread pool. Runnables posted to one mailbox run one at a time
 * in submission order; different mailboxes run in parallel.
 *
 * <p>The owning session id is put into the {@link ThreadContext} while a runnable executes.
 */
final class Mailbox implements Executor {

    private static final Logger LOG = LogManager.getLogger(Mailbox.class);

    private final String sessionId;
    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();

    Mailbox(String sessionId, Executor executor) {
        this.sessionId = sessionId;
        this.executor = executor;
    }

    @Override
    public void execute(Runnable command) {
        queue.add(command);
        schedule();
    }

    private void schedule() {
        if (queue.isEmpty() || !scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            LOG.error("Session executor rejected mailbox of session {}; {} events pending",
                    sessionId, queue.size(), e);
        }
    }

    private void drain() {
        ThreadContext.put("sessionId", sessionId);
        try {
            Runnable next;
            while ((next = queue.poll()) != null) {
                try {
                    next.run();
                } catch (RuntimeException e) {
                    LOG.error("Unhandled error in session {} event", sessionId, e);
                }
            }
        } finally {
            ThreadContext.remove("sessionId");
            scheduled.set(false);
        }
        // An event may have been posted between the last poll and the release above.
        schedule();
    }

    int pending() {
        return queue.size();
    }
}
