package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.domain.TaskType;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Point-in-time capacity report of one worker pool.
 *
 * <p>{@code idle + busy + unhealthy == total} always holds: {@code unhealthy} counts every slot
 * that cannot take work right now, including those still {@code starting} (reported separately
 * as a sub-count) and those terminating on shutdown.
 *
 * @param type       task type
 * @param total      configured slot count
 * @param idle       slots ready for work
 * @param busy       slots executing a task
 * @param unhealthy  slots unable to take work
 * @param starting   subset of {@code unhealthy} that is spawning and not yet ready
 * @param queueDepth tasks waiting for a slot
 * @param degraded   whether a slot has exhausted its restart budget
 * @param submitted  tasks accepted since start
 * @param completed  tasks resolved successfully
 * @param failed     tasks resolved with an error (timeouts, crashes, worker faults, cancellation)
 * @param crashes    slot failures
 * @param restarts   replacement processes spawned
 * @param slots      per-slot details
 */
public record PoolStatus(
        TaskType type,
        int total,
        int idle,
        int busy,
        int unhealthy,
        int starting,
        int queueDepth,
        boolean degraded,
        long submitted,
        long completed,
        long failed,
        long crashes,
        long restarts,
        List<SlotStatus> slots
) {

    public PoolStatus {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    /** Slots that are idle or busy. */
    public int available() {
        return idle + busy;
    }

    public JSONObject toJson() {
        JSONArray slotArray = new JSONArray();
        for (SlotStatus s : slots) {
            slotArray.put(s.toJson());
        }
        return new JSONObject()
                .put("type", type.wireName())
                .put("total", total)
                .put("idle", idle)
                .put("busy", busy)
                .put("unhealthy", unhealthy)
                .put("starting", starting)
                .put("queueDepth", queueDepth)
                .put("degraded", degraded)
                .put("submitted", submitted)
                .put("completed", completed)
                .put("failed", failed)
                .put("crashes", crashes)
                .put("restarts", restarts)
                .put("slots", slotArray);
    }

    /**
     * Snapshot of one slot.
     */
    public record SlotStatus(int index, SlotState state, String currentTaskId, int restartCount) {

        public JSONObject toJson() {
            JSONObject json = new JSONObject()
                    .put("index", index)
                    .put("state", state.name())
                    .put("restartCount", restartCount);
            if (currentTaskId != null) {
                json.put("currentTaskId", currentTaskId);
            }
            return json;
        }
    }
}
