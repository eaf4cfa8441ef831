package app.scapin.memory.worker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class LatchSleeperTest {

    private final LatchSleeper sleeper = new LatchSleeper();

    @Test
    void wakeBeforeSleepEndsNextSleepAtOnce() {
        sleeper.wake();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> sleeper.sleep(Duration.ofMinutes(10)));
    }

    @Test
    void pendingWakeIsConsumedBySingleSleep() throws Exception {
        sleeper.wake();
        sleeper.sleep(Duration.ofMinutes(10));

        long started = System.nanoTime();
        sleeper.sleep(Duration.ofMillis(200));

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
    }

    @Test
    void wakeEndsSleepInProgress() {
        CountDownLatch sleeping = new CountDownLatch(1);
        Thread waker = new Thread(() -> {
            try {
                if (sleeping.await(5, TimeUnit.SECONDS)) {
                    Thread.sleep(50);
                    sleeper.wake();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        waker.start();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            sleeping.countDown();
            sleeper.sleep(Duration.ofMinutes(10));
        });
    }

    @Test
    void nonPositiveDurationReturnsWithoutConsumingWake() throws Exception {
        sleeper.wake();
        sleeper.sleep(Duration.ZERO);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> sleeper.sleep(Duration.ofMinutes(10)));
    }
}
