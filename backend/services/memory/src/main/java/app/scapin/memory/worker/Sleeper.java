package app.scapin.memory.worker;

import java.time.Duration;

/**
 * Blocking wait used by the loop. {@link #wake()} ends a wait early.
 */
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    void wake();
}
