package app.scapin.memory.review.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Scheduling record of one note on one cycle track.
 * <p>
 * {@code importance} is a snapshot of the note-level attribute; the scheduler reads it for
 * ordering but never decides it.
 */
public record ReviewState(
        String noteId,
        CycleKind cycle,
        NoteType noteType,
        ImportanceLevel importance,
        double easinessFactor,
        int repetition,
        double intervalHours,
        Instant nextDueAt,
        Instant lastCompletedAt,
        int completionCount,
        Integer lastQuality
) {
    public ReviewState {
        Objects.requireNonNull(noteId, "noteId");
        Objects.requireNonNull(cycle, "cycle");
        noteType = noteType == null ? NoteType.OTHER : noteType;
        importance = importance == null ? ImportanceLevel.NORMAL : importance;
        repetition = Math.max(0, repetition);
        intervalHours = Math.max(0.0, intervalHours);
        completionCount = Math.max(0, completionCount);
    }

    public static ReviewState initial(String noteId, CycleKind cycle, NoteType noteType, ImportanceLevel importance) {
        NoteType type = noteType == null ? NoteType.OTHER : noteType;
        return new ReviewState(
                noteId,
                cycle,
                type,
                importance,
                type.reviewConfig().initialEasinessFactor(),
                0,
                0.0,
                null,
                null,
                0,
                null
        );
    }

    public boolean isDue(Instant now) {
        return nextDueAt == null || !nextDueAt.isAfter(now);
    }

    public ReviewState withNextDueAt(Instant next) {
        return new ReviewState(noteId, cycle, noteType, importance, easinessFactor, repetition, intervalHours,
                next, lastCompletedAt, completionCount, lastQuality);
    }

    public ReviewState withImportance(ImportanceLevel level) {
        return new ReviewState(noteId, cycle, noteType, level, easinessFactor, repetition, intervalHours,
                nextDueAt, lastCompletedAt, completionCount, lastQuality);
    }
}
