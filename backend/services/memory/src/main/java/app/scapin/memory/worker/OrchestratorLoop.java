package app.scapin.memory.worker;

import app.scapin.memory.analysis.ActionApplier;
import app.scapin.memory.analysis.AnalysisContext;
import app.scapin.memory.analysis.AnalysisResult;
import app.scapin.memory.analysis.EscalationPipeline;
import app.scapin.memory.config.WorkerProps;
import app.scapin.memory.content.ContentStore;
import app.scapin.memory.content.Note;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.service.ReviewStateNotFoundException;
import app.scapin.memory.review.service.Sm2Scheduler;
import app.scapin.memory.worker.digest.Digest;
import app.scapin.memory.worker.digest.DigestService;
import app.scapin.memory.worker.hygiene.ReviewStateJanitor;
import app.scapin.memory.worker.ingestion.IngestionCollaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Single-threaded control loop of the memory cycle.
 * <p>
 * Each iteration resets the daily counters on a new UTC day, checks the pause conditions, runs
 * the housekeeping that is due, publishes the digest once per local day, then works through a
 * Retouche batch (outside quiet hours) and a Lecture batch. Notes are processed one at a time and
 * each one is committed on its own.
 * <p>
 * Only one loop may run against a given review state store.
 */
@Component
public class OrchestratorLoop {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLoop.class);

    static final Duration FIRST_LECTURE_DELAY = Duration.ofHours(24);
    static final int FIRST_LECTURE_MIN_SCORE = 50;

    private final Sm2Scheduler scheduler;
    private final EscalationPipeline pipeline;
    private final ActionApplier actionApplier;
    private final ContentStore contentStore;
    private final IngestionCollaborator ingestion;
    private final ReviewStateJanitor janitor;
    private final DigestService digestService;
    private final WorkerProps props;
    private final Clock clock;
    private final Sleeper sleeper;
    private final List<MemoryCycleListener> listeners;
    private final ThrottlePolicy throttle;
    private final WorkerStats stats;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile WorkerState state = WorkerState.IDLE;
    private volatile boolean stopRequested;
    private volatile boolean pauseRequested;
    private volatile Instant sessionStartedAt;

    private Instant lastJanitorAt;
    private Instant lastIndexRefreshAt;
    private Instant lastIngestionAt;
    private Instant ingestionCursor;
    private LocalDate lastDigestDay;

    @Autowired
    public OrchestratorLoop(Sm2Scheduler scheduler,
                            EscalationPipeline pipeline,
                            ActionApplier actionApplier,
                            ContentStore contentStore,
                            IngestionCollaborator ingestion,
                            ReviewStateJanitor janitor,
                            DigestService digestService,
                            WorkerProps props,
                            Clock clock,
                            ObjectProvider<MemoryCycleListener> listeners,
                            ObjectProvider<ThrottlePolicy> throttle) {
        this(scheduler, pipeline, actionApplier, contentStore, ingestion, janitor, digestService, props, clock,
                new LatchSleeper(),
                listeners.orderedStream().toList(),
                throttle.getIfAvailable(() -> ThrottlePolicy.NEVER));
    }

    OrchestratorLoop(Sm2Scheduler scheduler,
                     EscalationPipeline pipeline,
                     ActionApplier actionApplier,
                     ContentStore contentStore,
                     IngestionCollaborator ingestion,
                     ReviewStateJanitor janitor,
                     DigestService digestService,
                     WorkerProps props,
                     Clock clock,
                     Sleeper sleeper,
                     List<MemoryCycleListener> listeners,
                     ThrottlePolicy throttle) {
        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.actionApplier = actionApplier;
        this.contentStore = contentStore;
        this.ingestion = ingestion;
        this.janitor = janitor;
        this.digestService = digestService;
        this.props = props;
        this.clock = clock;
        this.sleeper = sleeper;
        this.listeners = List.copyOf(listeners);
        this.throttle = throttle == null ? ThrottlePolicy.NEVER : throttle;
        this.stats = new WorkerStats(utcDay(clock.instant()));
        this.ingestionCursor = clock.instant();
    }

    /**
     * Runs iterations on the calling thread until {@link #stop()}.
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Memory cycle loop already running");
            return;
        }
        log.info("Memory cycle loop started maxDailyReviews={} maxDailyRetouches={} zone={}",
                props.maxDailyReviews(), props.maxDailyRetouches(), props.zone());
        try {
            while (!stopRequested) {
                Duration pause = runOnce();
                if (stopRequested) {
                    break;
                }
                sleeper.sleep(pause);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        } finally {
            transition(WorkerState.STOPPED);
            running.set(false);
            log.info("Memory cycle loop stopped");
        }
    }

    public void stop() {
        stopRequested = true;
        transition(WorkerState.STOPPED);
        sleeper.wake();
    }

    public void pause() {
        pauseRequested = true;
        log.info("Memory cycle pause requested");
    }

    public void resume() {
        pauseRequested = false;
        log.info("Memory cycle resume requested");
        sleeper.wake();
    }

    public WorkerState state() {
        return state;
    }

    public WorkerStatus status() {
        Instant now = clock.instant();
        return stats.snapshot(
                state,
                props.maxDailyReviews(),
                props.maxDailyRetouches(),
                isQuietHours(now),
                isDigestHour(now),
                sessionStartedAt
        );
    }

    /**
     * One iteration. Returns how long the loop should wait before the next one.
     */
    Duration runOnce() throws InterruptedException {
        if (stopRequested) {
            return Duration.ZERO;
        }
        try {
            Instant now = clock.instant();
            if (stats.resetIfNewDay(utcDay(now))) {
                log.info("Daily counters reset day={}", stats.countersDate());
            }

            if (pauseRequested || throttle.shouldPause(status()) || stats.reviewsToday() >= props.maxDailyReviews()) {
                transition(WorkerState.PAUSED);
                return props.sleepOnError();
            }
            transition(WorkerState.RUNNING);

            runHousekeeping(now);
            publishDigestIfDue(now);

            sessionStartedAt = clock.instant();
            int processed = 0;
            if (isQuietHours(now)) {
                log.debug("Quiet hours, Retouche skipped");
            } else if (stats.retouchesToday() < props.maxDailyRetouches()) {
                processed += retouchePass();
            }
            if (!stopRequested && stats.reviewsToday() < props.maxDailyReviews()) {
                processed += lecturePass();
            }

            if (processed == 0) {
                transition(WorkerState.IDLE);
                return min(props.sleepWhenIdle(), props.ingestionInterval());
            }
            return Duration.ZERO;
        } catch (InterruptedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            stats.recordError();
            log.error("Memory cycle iteration failed errorType={} message={}",
                    ex.getClass().getSimpleName(), safeMessage(ex), ex);
            return props.sleepOnError();
        }
    }

    private int retouchePass() throws InterruptedException {
        int budget = Math.min(props.retoucheBatchSize(), props.maxDailyRetouches() - stats.retouchesToday());
        List<ReviewState> due = scheduler.getDue(budget, CycleKind.RETOUCHE);
        return processBatch(due, this::processRetouche);
    }

    private int lecturePass() throws InterruptedException {
        int budget = Math.min(props.lectureBatchSize(), props.maxDailyReviews() - stats.reviewsToday());
        List<ReviewState> due = scheduler.getDue(budget, CycleKind.LECTURE);
        return processBatch(due, this::processLecture);
    }

    /**
     * Processes the batch in order. The batch ends early on stop, when the session budget is
     * spent, or when the UTC day changes, so the next iteration starts from fresh daily budgets.
     */
    private int processBatch(List<ReviewState> due, NoteProcessor processor) throws InterruptedException {
        LocalDate batchDay = utcDay(clock.instant());
        int processed = 0;
        for (int i = 0; i < due.size(); i++) {
            if (batchInterrupted(batchDay)) {
                break;
            }
            if (i > 0) {
                sleeper.sleep(props.sleepBetweenReviews());
                if (batchInterrupted(batchDay)) {
                    break;
                }
            }
            ReviewState target = due.get(i);
            try {
                if (processor.process(target)) {
                    processed++;
                }
            } catch (ReviewStateNotFoundException ex) {
                log.warn("Review state vanished noteId={} cycle={}", target.noteId(), target.cycle());
            } catch (RuntimeException ex) {
                stats.recordError();
                log.error("Note processing failed noteId={} cycle={} errorType={} message={}",
                        target.noteId(), target.cycle(), ex.getClass().getSimpleName(), safeMessage(ex));
            }
        }
        return processed;
    }

    private boolean processRetouche(ReviewState target) {
        Optional<NoteOutcome> outcome = analyseAndApply(target);
        if (outcome.isEmpty()) {
            return false;
        }
        NoteOutcome result = outcome.get();
        ReviewState updated = scheduler.recordReview(target.noteId(), CycleKind.RETOUCHE, result.cycleQuality());

        if (result.qualityScore() >= FIRST_LECTURE_MIN_SCORE) {
            scheduler.ensureScheduled(target.noteId(), CycleKind.LECTURE, result.note().noteType(),
                    result.note().importance(), clock.instant().plus(FIRST_LECTURE_DELAY));
        }

        Instant finished = clock.instant();
        Duration took = Duration.between(result.startedAt(), finished);
        stats.recordRetouche(result.applied(), result.pending(), finished, took);
        log.info("Retouche complete noteId={} score={} quality={} tier={} applied={} pending={}",
                target.noteId(), result.qualityScore(), result.cycleQuality(), result.analysis().tierUsed(),
                result.applied(), result.pending());
        notifyProcessed(result.toProcessingResult(CycleKind.RETOUCHE, updated.nextDueAt(), took));
        return true;
    }

    private boolean processLecture(ReviewState target) {
        Optional<NoteOutcome> outcome = analyseAndApply(target);
        if (outcome.isEmpty()) {
            return false;
        }
        NoteOutcome result = outcome.get();
        ReviewState updated = scheduler.recordReview(target.noteId(), CycleKind.LECTURE, result.cycleQuality());

        Instant finished = clock.instant();
        Duration took = Duration.between(result.startedAt(), finished);
        stats.recordLecture(result.applied(), result.pending(), finished, took);
        log.info("Lecture pass complete noteId={} score={} quality={} nextDueAt={}",
                target.noteId(), result.qualityScore(), result.cycleQuality(), updated.nextDueAt());
        notifyProcessed(result.toProcessingResult(CycleKind.LECTURE, updated.nextDueAt(), took));
        return true;
    }

    private Optional<NoteOutcome> analyseAndApply(ReviewState target) {
        Instant startedAt = clock.instant();
        Optional<Note> found = contentStore.get(target.noteId());
        if (found.isEmpty()) {
            log.warn("Note missing, review deferred noteId={} cycle={} hours={}",
                    target.noteId(), target.cycle(), props.janitorIntervalHours());
            scheduler.postpone(target.noteId(), target.cycle(), props.janitorIntervalHours());
            return Optional.empty();
        }
        Note note = found.get();

        AnalysisContext context = AnalysisContext.from(note);
        AnalysisResult analysis = pipeline.analyze(context);

        String updated = actionApplier.apply(note.content(), analysis.appliedActions());
        boolean changed = !updated.equals(note.content());
        if (changed) {
            contentStore.update(note.noteId(), updated);
        }

        int score = pipeline.qualityScore(context, analysis);
        return Optional.of(new NoteOutcome(
                note,
                analysis,
                score,
                EscalationPipeline.mapToCycleQuality(score),
                changed,
                startedAt
        ));
    }

    private void runHousekeeping(Instant now) {
        if (isDue(lastJanitorAt, props.janitorInterval(), now)) {
            lastJanitorAt = now;
            housekeeping("hygiene", janitor::sweep);
        }
        if (isDue(lastIndexRefreshAt, props.indexRefreshInterval(), now)) {
            lastIndexRefreshAt = now;
            housekeeping("index-refresh", contentStore::refreshIndex);
        }
        if (isDue(lastIngestionAt, props.ingestionInterval(), now)) {
            lastIngestionAt = now;
            Instant since = ingestionCursor;
            housekeeping("ingestion", () -> {
                List<Note> modified = contentStore.modifiedSince(since);
                if (!modified.isEmpty()) {
                    ingestion.process(modified);
                }
                ingestionCursor = now;
            });
        }
    }

    private void publishDigestIfDue(Instant now) {
        ZonedDateTime local = now.atZone(props.zoneId());
        if (local.getHour() != props.digestHour() || local.toLocalDate().equals(lastDigestDay)) {
            return;
        }
        lastDigestDay = local.toLocalDate();
        housekeeping("digest", () -> {
            Digest digest = digestService.generate();
            notifyListeners(l -> l.onDigest(digest));
        });
    }

    private void housekeeping(String task, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            stats.recordError();
            log.warn("Housekeeping failed task={} errorType={} message={}",
                    task, ex.getClass().getSimpleName(), safeMessage(ex));
        }
    }

    boolean isQuietHours(Instant now) {
        return isQuietHour(now.atZone(props.zoneId()).getHour(), props.quietHoursStart(), props.quietHoursEnd());
    }

    boolean isDigestHour(Instant now) {
        return now.atZone(props.zoneId()).getHour() == props.digestHour();
    }

    /**
     * Quiet window is [start, end) and wraps past midnight when start is after end. Equal bounds
     * mean no quiet hours.
     */
    static boolean isQuietHour(int hour, int start, int end) {
        if (start == end) {
            return false;
        }
        if (start > end) {
            return hour >= start || hour < end;
        }
        return hour >= start && hour < end;
    }

    private boolean batchInterrupted(LocalDate batchDay) {
        if (stopRequested || sessionExpired()) {
            return true;
        }
        if (!utcDay(clock.instant()).equals(batchDay)) {
            log.debug("UTC day changed during batch day={}", batchDay);
            return true;
        }
        return false;
    }

    private boolean sessionExpired() {
        Instant started = sessionStartedAt;
        if (started == null) {
            return false;
        }
        boolean expired = !Duration.between(started, clock.instant()).minus(props.maxSession()).isNegative();
        if (expired) {
            log.debug("Session budget exhausted startedAt={}", started);
        }
        return expired;
    }

    private void transition(WorkerState next) {
        WorkerState previous;
        synchronized (this) {
            previous = state;
            if (previous == next || previous == WorkerState.STOPPED) {
                return;
            }
            state = next;
        }
        log.info("Memory cycle state changed from={} to={}", previous, next);
        notifyListeners(l -> l.onStateChange(previous, next));
    }

    private void notifyProcessed(NoteProcessingResult result) {
        notifyListeners(l -> l.onNoteProcessed(result));
    }

    private void notifyListeners(Consumer<MemoryCycleListener> event) {
        for (MemoryCycleListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("Listener failed listener={} errorType={} message={}",
                        listener.getClass().getSimpleName(), ex.getClass().getSimpleName(), safeMessage(ex));
            }
        }
    }

    private static boolean isDue(Instant last, Duration interval, Instant now) {
        return last == null || !now.isBefore(last.plus(interval));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static LocalDate utcDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private static String safeMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    @FunctionalInterface
    private interface NoteProcessor {
        boolean process(ReviewState state);
    }

    private record NoteOutcome(
            Note note,
            AnalysisResult analysis,
            int qualityScore,
            int cycleQuality,
            boolean contentUpdated,
            Instant startedAt
    ) {
        int applied() {
            return analysis.appliedActions().size();
        }

        int pending() {
            return analysis.pendingActions().size();
        }

        NoteProcessingResult toProcessingResult(CycleKind cycle, Instant nextDueAt, Duration took) {
            return new NoteProcessingResult(
                    note.noteId(),
                    cycle,
                    qualityScore,
                    cycleQuality,
                    analysis.tierUsed(),
                    analysis.escalated(),
                    applied(),
                    analysis.pendingActions(),
                    contentUpdated,
                    nextDueAt,
                    took
            );
        }
    }
}
