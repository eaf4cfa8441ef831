package app.scapin.memory.worker;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Loop counters. Daily counters belong to {@link #countersDate()} (UTC) and are reset by
 * {@link #resetIfNewDay(LocalDate)}, or by a pass recorded on a later UTC day.
 */
public class WorkerStats {

    private LocalDate countersDate;
    private int reviewsToday;
    private int retouchesToday;
    private int errorsToday;
    private long reviewsTotal;
    private long retouchesTotal;
    private long actionsApplied;
    private long actionsPending;
    private Instant lastActivityAt;
    private Instant lastRetoucheAt;
    private Instant lastLectureAt;
    private long processedNotes;
    private long processingMillis;

    public WorkerStats(LocalDate today) {
        this.countersDate = today;
    }

    public synchronized boolean resetIfNewDay(LocalDate today) {
        if (today.equals(countersDate)) {
            return false;
        }
        countersDate = today;
        reviewsToday = 0;
        retouchesToday = 0;
        errorsToday = 0;
        return true;
    }

    public synchronized void recordRetouche(int applied, int pending, Instant at, Duration took) {
        rollForward(at);
        retouchesToday++;
        retouchesTotal++;
        lastRetoucheAt = at;
        recordProcessed(applied, pending, at, took);
    }

    public synchronized void recordLecture(int applied, int pending, Instant at, Duration took) {
        rollForward(at);
        reviewsToday++;
        reviewsTotal++;
        lastLectureAt = at;
        recordProcessed(applied, pending, at, took);
    }

    public synchronized void recordError() {
        errorsToday++;
    }

    public synchronized LocalDate countersDate() {
        return countersDate;
    }

    public synchronized int reviewsToday() {
        return reviewsToday;
    }

    public synchronized int retouchesToday() {
        return retouchesToday;
    }

    public synchronized int errorsToday() {
        return errorsToday;
    }

    synchronized WorkerStatus snapshot(WorkerState state,
                                       int maxDailyReviews,
                                       int maxDailyRetouches,
                                       boolean quietHours,
                                       boolean digestHour,
                                       Instant sessionStartedAt) {
        double average = processedNotes == 0 ? 0.0 : processingMillis / 1000.0 / processedNotes;
        return new WorkerStatus(
                state,
                countersDate,
                reviewsToday,
                retouchesToday,
                errorsToday,
                reviewsTotal,
                retouchesTotal,
                actionsApplied,
                actionsPending,
                Math.max(0, maxDailyReviews - reviewsToday),
                Math.max(0, maxDailyRetouches - retouchesToday),
                quietHours,
                digestHour,
                sessionStartedAt,
                lastActivityAt,
                lastRetoucheAt,
                lastLectureAt,
                average
        );
    }

    private void rollForward(Instant at) {
        LocalDate day = LocalDate.ofInstant(at, ZoneOffset.UTC);
        if (day.isAfter(countersDate)) {
            resetIfNewDay(day);
        }
    }

    private void recordProcessed(int applied, int pending, Instant at, Duration took) {
        actionsApplied += Math.max(applied, 0);
        actionsPending += Math.max(pending, 0);
        lastActivityAt = at;
        processedNotes++;
        processingMillis += took == null ? 0 : Math.max(took.toMillis(), 0);
    }
}
