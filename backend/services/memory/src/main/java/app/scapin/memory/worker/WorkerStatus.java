package app.scapin.memory.worker;

import java.time.Instant;
import java.time.LocalDate;

public record WorkerStatus(
        WorkerState state,
        LocalDate countersDate,
        int reviewsToday,
        int retouchesToday,
        int errorsToday,
        long reviewsTotal,
        long retouchesTotal,
        long actionsApplied,
        long actionsPending,
        int remainingReviews,
        int remainingRetouches,
        boolean quietHours,
        boolean digestHour,
        Instant sessionStartedAt,
        Instant lastActivityAt,
        Instant lastRetoucheAt,
        Instant lastLectureAt,
        double averageProcessingSeconds
) {
}
