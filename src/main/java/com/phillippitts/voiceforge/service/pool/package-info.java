/**
 * Worker pools: fixed sets of out-of-process workers per task type.
 *
 * <p>Each {@link com.phillippitts.voiceforge.service.pool.WorkerPool} owns its slots and queue
 * on a single dispatch thread. Callers interact only through commands posted to its inbox and
 * the futures it returns. The {@link com.phillippitts.voiceforge.service.pool.PoolRegistry}
 * maps task types to pools and is the {@link com.phillippitts.voiceforge.service.pool.TaskRouter}
 * the rest of the application uses.
 *
 * <p>Worker lifecycle:
 * <pre>
 * STARTING → IDLE ⇄ BUSY
 *     ↓        ↓      ↓
 *    UNHEALTHY (crash, missed pong, deadline) → STARTING (restart budget allows)
 * any → TERMINATING (shutdown)
 * </pre>
 *
 * @see com.phillippitts.voiceforge.service.worker.WorkerMain
 */
package com.phillippitts.voiceforge.service.pool;
