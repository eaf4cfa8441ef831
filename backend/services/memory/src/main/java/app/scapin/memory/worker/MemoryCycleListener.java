package app.scapin.memory.worker;

import app.scapin.memory.worker.digest.Digest;

/**
 * Receives loop events. Listeners run on the loop thread; a failing listener is logged and
 * skipped.
 */
public interface MemoryCycleListener {

    default void onStateChange(WorkerState previous, WorkerState current) {
    }

    default void onNoteProcessed(NoteProcessingResult result) {
    }

    default void onDigest(Digest digest) {
    }
}
