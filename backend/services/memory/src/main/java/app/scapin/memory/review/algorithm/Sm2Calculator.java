package app.scapin.memory.review.algorithm;

import app.scapin.memory.review.domain.ReviewConfig;
import app.scapin.memory.review.domain.ReviewState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * SM-2 variant working in hours.
 * <p>
 * Interval progression: I(1) = base interval of the note type, I(2) = 12h, I(n) = I(n-1) * EF,
 * capped at the type's maximum. A rating below 3 resets the progression.
 */
@Component
public class Sm2Calculator {

    public static final double SECOND_INTERVAL_HOURS = 12.0;
    public static final double MIN_EASINESS = 1.3;
    public static final double MAX_EASINESS = 2.5;
    public static final int PASS_THRESHOLD = 3;

    public SchedulingResult calculate(ReviewState state, int quality, ReviewConfig config, Instant now) {
        requireValidQuality(quality);

        if (config.skipRevision()) {
            return new SchedulingResult(
                    null,
                    state.easinessFactor(),
                    state.intervalHours(),
                    state.repetition(),
                    "Type exempt from review"
            );
        }

        int lapse = 5 - quality;
        double efDelta = 0.1 - lapse * (0.08 + lapse * 0.02);
        double ef = clamp(state.easinessFactor() + efDelta, MIN_EASINESS, MAX_EASINESS);

        double interval;
        int repetition;
        if (quality < PASS_THRESHOLD) {
            repetition = 0;
            interval = config.baseIntervalHours();
        } else {
            repetition = state.repetition() + 1;
            if (repetition == 1) {
                interval = config.baseIntervalHours();
            } else if (repetition == 2) {
                interval = SECOND_INTERVAL_HOURS;
            } else {
                interval = state.intervalHours() * ef;
            }
            interval = Math.min(interval, config.maxIntervalHours());
        }

        Instant next = now.plus(hours(interval));
        return new SchedulingResult(next, ef, interval, repetition, assessment(quality, quality < PASS_THRESHOLD));
    }

    public static void requireValidQuality(int quality) {
        if (quality < 0 || quality > 5) {
            throw new InvalidQualityException(quality);
        }
    }

    public static Duration hours(double hours) {
        return Duration.ofMillis(Math.round(hours * 3_600_000d));
    }

    private static String assessment(int quality, boolean reset) {
        String base = switch (quality) {
            case 5 -> "Perfect - no changes needed";
            case 4 -> "Good - minor fixes only";
            case 3 -> "Fair - small additions or clarifications";
            case 2 -> "Weak - moderate updates required";
            case 1 -> "Poor - significant restructuring needed";
            default -> "Insufficient - major overhaul required";
        };
        return reset ? base + " (interval reset)" : base;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
