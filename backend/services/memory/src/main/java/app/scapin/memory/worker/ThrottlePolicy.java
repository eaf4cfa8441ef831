package app.scapin.memory.worker;

/**
 * Extra pause condition checked at the start of every loop iteration, e.g. host load or an
 * upstream rate limit.
 */
@FunctionalInterface
public interface ThrottlePolicy {

    ThrottlePolicy NEVER = status -> false;

    boolean shouldPause(WorkerStatus status);
}
