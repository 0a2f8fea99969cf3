package com.phillippitts.voiceforge.service.pool;

import com.phillippitts.voiceforge.service.worker.protocol.WorkerMessage;

/**
 * Callbacks from a slot's stdout reader thread. Both calls carry the process generation so the
 * pool can discard output of a process it has already replaced.
 */
interface SlotListener {

    void onMessage(int slot, long generation, WorkerMessage message);

    void onStdoutClosed(int slot, long generation);
}
