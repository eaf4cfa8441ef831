package app.scapin.memory.lecture;

import app.scapin.memory.content.ContentStore;
import app.scapin.memory.content.Note;
import app.scapin.memory.review.algorithm.Sm2Calculator;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.service.ReviewStateNotFoundException;
import app.scapin.memory.review.service.Sm2Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human review sessions on the LECTURE track. Sessions live in memory only.
 */
@Service
public class LectureService {

    private static final Logger log = LoggerFactory.getLogger(LectureService.class);

    static final String ANSWERS_HEADING = "## Answers";
    static final Duration SESSION_TTL = Duration.ofHours(24);

    private static final Pattern QUESTIONS_SECTION = Pattern.compile(
            "^##\\s*Questions?[^\\n]*\\n(.*?)(?=\\n##\\s|\\z)",
            Pattern.MULTILINE | Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern QUESTION_BULLET = Pattern.compile("^\\s*(?:[-*]|\\d+\\.)\\s+(.+\\?)\\s*$", Pattern.MULTILINE);

    private final ContentStore contentStore;
    private final Sm2Scheduler scheduler;
    private final Clock clock;
    private final Map<String, LectureSession> sessions = new ConcurrentHashMap<>();

    public LectureService(ContentStore contentStore, Sm2Scheduler scheduler, Clock clock) {
        this.contentStore = contentStore;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public Optional<LectureSession> start(String noteId) {
        expireSessions(clock.instant());
        Optional<Note> note = contentStore.get(noteId);
        if (note.isEmpty()) {
            log.warn("Lecture not started, note not found noteId={}", noteId);
            return Optional.empty();
        }
        ReviewState state = scheduler.ensureScheduled(
                noteId, CycleKind.LECTURE, note.get().noteType(), note.get().importance(), null);

        LectureSession session = new LectureSession(
                UUID.randomUUID().toString(),
                noteId,
                note.get().title(),
                note.get().content(),
                note.get().noteType(),
                clock.instant(),
                state.completionCount(),
                state.lastCompletedAt(),
                extractQuestions(note.get().content())
        );
        sessions.put(session.sessionId(), session);
        log.info("Lecture started noteId={} sessionId={} questions={}", noteId, session.sessionId(), session.questions().size());
        return Optional.of(session);
    }

    public Optional<LectureResult> complete(String noteId, int quality, String sessionId) {
        return complete(noteId, quality, Map.of(), sessionId);
    }

    /**
     * Records the human rating on the LECTURE track. Answers, keyed by question, are appended
     * to the note before the review is recorded.
     */
    public Optional<LectureResult> complete(String noteId, int quality, Map<String, String> answers, String sessionId) {
        Sm2Calculator.requireValidQuality(quality);

        if (scheduler.findState(noteId, CycleKind.LECTURE).isEmpty()) {
            log.warn("Lecture not recorded, no state noteId={}", noteId);
            return Optional.empty();
        }

        int recorded = 0;
        if (answers != null && !answers.isEmpty()) {
            recorded = recordAnswers(noteId, answers);
        }

        ReviewState updated;
        try {
            updated = scheduler.recordReview(noteId, CycleKind.LECTURE, quality);
        } catch (ReviewStateNotFoundException ex) {
            log.warn("Lecture not recorded, no state noteId={}", noteId);
            return Optional.empty();
        }

        if (sessionId != null) {
            sessions.remove(sessionId);
        }
        log.info("Lecture complete noteId={} quality={} intervalHours={} answers={}",
                noteId, quality, updated.intervalHours(), recorded);
        return Optional.of(new LectureResult(noteId, quality, updated.nextDueAt(), updated.intervalHours(), recorded));
    }

    public boolean cancel(String sessionId) {
        if (sessionId == null || sessions.remove(sessionId) == null) {
            return false;
        }
        log.info("Lecture cancelled sessionId={}", sessionId);
        return true;
    }

    public Optional<LectureSession> activeSession(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public List<LectureSession> sessionsFor(String noteId) {
        return sessions.values().stream()
                .filter(s -> s.noteId().equals(noteId))
                .toList();
    }

    /**
     * Drops sessions started more than {@link #SESSION_TTL} ago.
     */
    int expireSessions(Instant now) {
        Instant cutoff = now.minus(SESSION_TTL);
        int before = sessions.size();
        sessions.values().removeIf(s -> s.startedAt().isBefore(cutoff));
        int expired = before - sessions.size();
        if (expired > 0) {
            log.info("Lecture sessions expired count={}", expired);
        }
        return expired;
    }

    static List<String> extractQuestions(String content) {
        List<String> questions = new ArrayList<>();
        if (content == null) {
            return questions;
        }
        Matcher section = QUESTIONS_SECTION.matcher(content);
        if (section.find()) {
            addBullets(section.group(1), questions);
        }
        addBullets(content, questions);
        return questions;
    }

    private static void addBullets(String text, List<String> questions) {
        Matcher bullet = QUESTION_BULLET.matcher(text);
        while (bullet.find()) {
            String question = bullet.group(1).trim();
            if (!questions.contains(question)) {
                questions.add(question);
            }
        }
    }

    private int recordAnswers(String noteId, Map<String, String> answers) {
        Optional<Note> note = contentStore.get(noteId);
        if (note.isEmpty()) {
            return 0;
        }
        StringBuilder content = new StringBuilder(note.get().content().stripTrailing());
        if (!note.get().content().contains(ANSWERS_HEADING)) {
            content.append("\n\n").append(ANSWERS_HEADING).append("\n");
        }
        content.append('\n');
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        answers.forEach((question, answer) ->
                content.append("- **").append(question).append("** (").append(today).append("): ")
                        .append(answer).append('\n'));
        contentStore.update(noteId, content.toString());
        return answers.size();
    }
}
