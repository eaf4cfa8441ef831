package app.scapin.memory.review.algorithm;

import java.time.Instant;

/**
 * @param nextDueAt null for types that are exempt from review
 */
public record SchedulingResult(
        Instant nextDueAt,
        double easinessFactor,
        double intervalHours,
        int repetition,
        String assessment
) {
}
