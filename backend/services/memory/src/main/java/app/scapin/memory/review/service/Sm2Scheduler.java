package app.scapin.memory.review.service;

import app.scapin.memory.review.algorithm.SchedulingResult;
import app.scapin.memory.review.algorithm.Sm2Calculator;
import app.scapin.memory.review.api.ReviewStatePort;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import app.scapin.memory.review.domain.ReviewState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;

@Service
public class Sm2Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Sm2Scheduler.class);

    private static final int WORKLOAD_SCAN_LIMIT = 10_000;

    static final Comparator<ReviewState> DUE_ORDER = Comparator
            .comparingInt((ReviewState s) -> s.importance().rank())
            .thenComparing(ReviewState::nextDueAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ReviewStatePort states;
    private final Sm2Calculator calculator;
    private final Clock clock;

    public Sm2Scheduler(ReviewStatePort states, Sm2Calculator calculator, Clock clock) {
        this.states = states;
        this.calculator = calculator;
        this.clock = clock;
    }

    public SchedulingResult calculate(ReviewState state, int quality) {
        return calculator.calculate(state, quality, state.noteType().reviewConfig(), clock.instant());
    }

    public Optional<ReviewState> findState(String noteId, CycleKind cycle) {
        return states.find(noteId, cycle);
    }

    public ReviewState recordReview(String noteId, CycleKind cycle, int quality) {
        Sm2Calculator.requireValidQuality(quality);

        ReviewState current = states.find(noteId, cycle)
                .orElseThrow(() -> new ReviewStateNotFoundException(noteId, cycle));

        Instant now = clock.instant();
        SchedulingResult result = calculator.calculate(current, quality, current.noteType().reviewConfig(), now);

        ReviewState next = new ReviewState(
                current.noteId(),
                current.cycle(),
                current.noteType(),
                current.importance(),
                result.easinessFactor(),
                result.repetition(),
                result.intervalHours(),
                result.nextDueAt(),
                now,
                current.completionCount() + 1,
                quality
        );
        ReviewState saved = states.save(next);

        log.info("Review recorded noteId={} cycle={} quality={} ef={} intervalHours={} assessment={}",
                noteId, cycle, quality, String.format(Locale.ROOT, "%.2f", result.easinessFactor()),
                String.format(Locale.ROOT, "%.1f", result.intervalHours()), result.assessment());
        return saved;
    }

    public List<ReviewState> getDue(int limit, CycleKind cycle) {
        return getDue(limit, cycle, null);
    }

    public List<ReviewState> getDue(int limit, CycleKind cycle, Collection<NoteType> typeFilter) {
        if (limit <= 0) {
            return List.of();
        }
        List<NoteType> types = reviewableTypes(typeFilter);
        if (types.isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        return states.findDue(limit, cycle, types, now).stream()
                .filter(s -> s.noteType().isReviewable())
                .filter(s -> s.importance().isSelectable())
                .filter(s -> s.isDue(now))
                .sorted(DUE_ORDER)
                .limit(limit)
                .toList();
    }

    /**
     * Returns the state of the note on the given track, creating it with type defaults when the
     * note has never been scheduled there. {@code firstDueAt} only applies to a created state.
     */
    public ReviewState ensureScheduled(String noteId,
                                       CycleKind cycle,
                                       NoteType type,
                                       ImportanceLevel importance,
                                       Instant firstDueAt) {
        Optional<ReviewState> existing = states.find(noteId, cycle);
        if (existing.isPresent()) {
            return existing.get();
        }
        ReviewState created = states.createDefault(noteId, cycle, type, importance);
        if (firstDueAt != null && created.noteType().isReviewable()) {
            created = states.save(created.withNextDueAt(firstDueAt));
        }
        log.debug("Review state created noteId={} cycle={} type={} firstDueAt={}", noteId, cycle, type, firstDueAt);
        return created;
    }

    /**
     * Copies the note-level importance onto every existing state of the note.
     */
    public void refreshImportance(String noteId, ImportanceLevel importance) {
        for (CycleKind cycle : CycleKind.values()) {
            states.find(noteId, cycle)
                    .filter(s -> s.importance() != importance)
                    .ifPresent(s -> {
                        states.save(s.withImportance(importance));
                        log.debug("Importance refreshed noteId={} cycle={} importance={}", noteId, cycle, importance);
                    });
        }
    }

    public boolean triggerImmediate(String noteId, CycleKind cycle) {
        Optional<ReviewState> state = states.find(noteId, cycle);
        if (state.isEmpty()) {
            log.warn("Cannot trigger review, state not found noteId={} cycle={}", noteId, cycle);
            return false;
        }
        if (!state.get().noteType().isReviewable()) {
            log.debug("Trigger ignored for exempt type noteId={} type={}", noteId, state.get().noteType());
            return false;
        }
        states.save(state.get().withNextDueAt(clock.instant()));
        log.info("Immediate review triggered noteId={} cycle={}", noteId, cycle);
        return true;
    }

    public boolean postpone(String noteId, CycleKind cycle, double hours) {
        if (hours < 0 || Double.isNaN(hours)) {
            throw new IllegalArgumentException("Postpone hours must be >= 0, got " + hours);
        }
        Optional<ReviewState> state = states.find(noteId, cycle);
        if (state.isEmpty()) {
            log.warn("Cannot postpone review, state not found noteId={} cycle={}", noteId, cycle);
            return false;
        }
        if (!state.get().noteType().isReviewable()) {
            log.debug("Postpone ignored for exempt type noteId={} type={}", noteId, state.get().noteType());
            return false;
        }
        Instant now = clock.instant();
        Instant current = state.get().nextDueAt();
        Instant base = (current == null || current.isBefore(now)) ? now : current;
        states.save(state.get().withNextDueAt(base.plus(Sm2Calculator.hours(hours))));
        log.info("Review postponed noteId={} cycle={} hours={}", noteId, cycle, hours);
        return true;
    }

    public Map<LocalDate, Long> estimateWorkload(int days) {
        return estimateWorkload(days, null);
    }

    /**
     * Counts scheduled reviews per UTC day, starting today, for {@code days} days. A null cycle
     * counts both tracks.
     */
    public Map<LocalDate, Long> estimateWorkload(int days, CycleKind cycle) {
        Map<LocalDate, Long> workload = new LinkedHashMap<>();
        if (days <= 0) {
            return workload;
        }
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDate end = today.plusDays(days);
        for (int i = 0; i < days; i++) {
            workload.put(today.plusDays(i), 0L);
        }

        for (ReviewState state : states.listAll(WORKLOAD_SCAN_LIMIT)) {
            if (state.nextDueAt() == null || (cycle != null && state.cycle() != cycle)) {
                continue;
            }
            LocalDate day = LocalDate.ofInstant(state.nextDueAt(), ZoneOffset.UTC);
            if (!day.isBefore(today) && day.isBefore(end)) {
                workload.merge(day, 1L, Long::sum);
            }
        }
        return workload;
    }

    public ReviewStats reviewStats(CycleKind cycle) {
        List<ReviewState> due = getDue(WORKLOAD_SCAN_LIMIT, cycle);
        Map<NoteType, Long> byType = new EnumMap<>(NoteType.class);
        for (ReviewState state : due) {
            byType.merge(state.noteType(), 1L, Long::sum);
        }
        Instant startOfDay = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
        long completedToday = states.countCompletedSince(cycle, startOfDay);
        return new ReviewStats(cycle, due.size(), completedToday, byType);
    }

    private static List<NoteType> reviewableTypes(Collection<NoteType> typeFilter) {
        Collection<NoteType> candidates = (typeFilter == null) ? EnumSet.allOf(NoteType.class) : typeFilter;
        return candidates.stream()
                .filter(Objects::nonNull)
                .filter(NoteType::isReviewable)
                .distinct()
                .toList();
    }

    public record ReviewStats(CycleKind cycle, long totalDue, long completedToday, Map<NoteType, Long> dueByType) {
    }
}
