package app.scapin.memory.review.domain;

/**
 * Static review parameters attached to a {@link NoteType}.
 *
 * @param baseIntervalHours     interval used for the first pass and after a failed review
 * @param maxIntervalDays       upper bound for the grown interval
 * @param initialEasinessFactor easiness factor of a freshly created state
 * @param autoEnrich            whether automated enrichment is enabled by default
 * @param webSearchDefault      whether web lookups are enabled by default
 * @param skipRevision          types flagged here are never scheduled
 */
public record ReviewConfig(
        double baseIntervalHours,
        int maxIntervalDays,
        double initialEasinessFactor,
        boolean autoEnrich,
        boolean webSearchDefault,
        boolean skipRevision
) {

    public double maxIntervalHours() {
        return maxIntervalDays * 24.0;
    }
}
