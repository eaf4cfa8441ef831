package app.scapin.memory.review.adapter;

import app.scapin.memory.review.api.ReviewStatePort;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.entity.ReviewStateEntity;
import app.scapin.memory.review.entity.ReviewStateKey;
import app.scapin.memory.review.repository.ReviewStateJpaRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class JpaReviewStateAdapter implements ReviewStatePort {

    private final ReviewStateJpaRepository repository;
    private final Clock clock;

    public JpaReviewStateAdapter(ReviewStateJpaRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ReviewState> find(String noteId, CycleKind cycle) {
        return repository.findById(new ReviewStateKey(noteId, cycle)).map(JpaReviewStateAdapter::toDomain);
    }

    @Override
    @Transactional
    public ReviewState save(ReviewState state) {
        Instant now = clock.instant();
        ReviewStateEntity entity = repository.findById(new ReviewStateKey(state.noteId(), state.cycle()))
                .orElseGet(() -> newEntity(state, now));
        apply(entity, state);
        entity.setUpdatedAt(now);
        return toDomain(repository.save(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewState> listAll(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findAll(PageRequest.of(0, limit, Sort.by("noteId", "cycle"))).stream()
                .map(JpaReviewStateAdapter::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewState> findDue(int limit, CycleKind cycle, Collection<NoteType> types, Instant now) {
        if (limit <= 0 || types == null || types.isEmpty()) {
            return List.of();
        }
        return repository.findDue(cycle, types, ImportanceLevel.ARCHIVE, now, PageRequest.of(0, limit)).stream()
                .map(JpaReviewStateAdapter::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public ReviewState createDefault(String noteId, CycleKind cycle, NoteType type, ImportanceLevel importance) {
        Optional<ReviewState> existing = find(noteId, cycle);
        if (existing.isPresent()) {
            return existing.get();
        }
        ReviewState initial = ReviewState.initial(noteId, cycle, type, importance);
        try {
            return toDomain(repository.saveAndFlush(newEntity(initial, clock.instant())));
        } catch (DataIntegrityViolationException ex) {
            return find(noteId, cycle).orElseThrow(() -> ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countCompletedSince(CycleKind cycle, Instant since) {
        return repository.countCompletedSince(cycle, since);
    }

    private static ReviewStateEntity newEntity(ReviewState state, Instant now) {
        ReviewStateEntity entity = new ReviewStateEntity();
        entity.setNoteId(state.noteId());
        entity.setCycle(state.cycle());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        apply(entity, state);
        return entity;
    }

    private static void apply(ReviewStateEntity entity, ReviewState state) {
        entity.setNoteType(state.noteType());
        entity.setImportance(state.importance());
        entity.setEasinessFactor(state.easinessFactor());
        entity.setRepetition(state.repetition());
        entity.setIntervalHours(state.intervalHours());
        entity.setNextDueAt(state.nextDueAt());
        entity.setLastCompletedAt(state.lastCompletedAt());
        entity.setCompletionCount(state.completionCount());
        entity.setLastQuality(state.lastQuality());
    }

    static ReviewState toDomain(ReviewStateEntity entity) {
        return new ReviewState(
                entity.getNoteId(),
                entity.getCycle(),
                entity.getNoteType(),
                entity.getImportance(),
                entity.getEasinessFactor(),
                entity.getRepetition(),
                entity.getIntervalHours(),
                entity.getNextDueAt(),
                entity.getLastCompletedAt(),
                entity.getCompletionCount(),
                entity.getLastQuality()
        );
    }
}
