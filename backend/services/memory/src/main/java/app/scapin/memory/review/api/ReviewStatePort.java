package app.scapin.memory.review.api;

import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import app.scapin.memory.review.domain.ReviewState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage of review states, one per (note, cycle) key.
 * <p>
 * Implementations must make {@link #save} atomic per key. The scheduler does not lock: a write
 * from another process between its read and its write is overwritten.
 */
public interface ReviewStatePort {

    Optional<ReviewState> find(String noteId, CycleKind cycle);

    ReviewState save(ReviewState state);

    List<ReviewState> listAll(int limit);

    /**
     * States of the given cycle that are due at {@code now} (or never scheduled), restricted to
     * {@code types}, excluding archived notes.
     */
    List<ReviewState> findDue(int limit, CycleKind cycle, Collection<NoteType> types, Instant now);

    ReviewState createDefault(String noteId, CycleKind cycle, NoteType type, ImportanceLevel importance);

    long countCompletedSince(CycleKind cycle, Instant since);
}
