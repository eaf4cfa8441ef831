package app.scapin.memory.worker;

import java.time.Duration;

/**
 * Monitor-based {@link Sleeper}. A wake that arrives while no thread is sleeping is kept and ends
 * the next sleep immediately.
 */
class LatchSleeper implements Sleeper {

    private final Object lock = new Object();
    private boolean wakePending;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        long deadline = System.nanoTime() + duration.toNanos();
        synchronized (lock) {
            long remaining = duration.toNanos();
            while (!wakePending && remaining > 0) {
                lock.wait(Math.max(1L, remaining / 1_000_000L));
                remaining = deadline - System.nanoTime();
            }
            wakePending = false;
        }
    }

    @Override
    public void wake() {
        synchronized (lock) {
            wakePending = true;
            lock.notifyAll();
        }
    }
}
