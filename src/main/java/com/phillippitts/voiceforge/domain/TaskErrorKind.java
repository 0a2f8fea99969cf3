package com.phillippitts.voiceforge.domain;

/**
 * Error taxonomy for task resolution. Names are used verbatim on the wire.
 */
public enum TaskErrorKind {
    /** Worker process died or stopped answering pings; the pool restarts it. */
    WORKER_CRASHED,
    /** Task waited longer than its deadline without being dispatched. */
    QUEUE_TIMEOUT,
    /** Task ran longer than its deadline; handled like a crash of that slot. */
    EXECUTION_TIMEOUT,
    /** Submission rejected because the pool is draining. */
    POOL_SHUTTING_DOWN,
    /** Worker reported a fault while executing the task. */
    TASK_FAILED,
    /** Queued task removed by its submitter. */
    CANCELLED,
    /** No pool registered for the task type. */
    UNKNOWN_TASK_TYPE
}
