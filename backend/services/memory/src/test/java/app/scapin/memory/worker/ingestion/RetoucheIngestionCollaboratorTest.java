package app.scapin.memory.worker.ingestion;

import app.scapin.memory.content.Note;
import app.scapin.memory.review.algorithm.Sm2Calculator;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.service.Sm2Scheduler;
import app.scapin.memory.support.InMemoryReviewStatePort;
import app.scapin.memory.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetoucheIngestionCollaboratorTest {

    private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

    InMemoryReviewStatePort port;
    Sm2Scheduler scheduler;
    RetoucheIngestionCollaborator collaborator;

    @BeforeEach
    void setup() {
        MutableClock clock = new MutableClock(NOW);
        port = new InMemoryReviewStatePort();
        scheduler = new Sm2Scheduler(port, new Sm2Calculator(), clock);
        collaborator = new RetoucheIngestionCollaborator(scheduler);
    }

    @Test
    void newNoteGetsRetoucheState() {
        collaborator.process(List.of(note("inbox/idea", NoteType.OTHER, ImportanceLevel.NORMAL, NOW)));

        ReviewState state = port.find("inbox/idea", CycleKind.RETOUCHE).orElseThrow();
        assertThat(state.nextDueAt()).isNull();
        assertThat(port.find("inbox/idea", CycleKind.LECTURE)).isEmpty();
    }

    @Test
    void noteEditedAfterRetoucheIsDueNow() {
        Instant lastRetouche = NOW.minus(Duration.ofHours(5));
        port.save(new ReviewState("people/alice", CycleKind.RETOUCHE, NoteType.PERSON, ImportanceLevel.NORMAL,
                2.3, 2, 12.0, NOW.plus(Duration.ofHours(7)), lastRetouche, 2, 4));
        port.save(new ReviewState("people/alice", CycleKind.LECTURE, NoteType.PERSON, ImportanceLevel.NORMAL,
                2.3, 1, 2.0, NOW.plus(Duration.ofHours(1)), lastRetouche, 1, 4));

        collaborator.process(List.of(note("people/alice", NoteType.PERSON, ImportanceLevel.CRITICAL, NOW.minusSeconds(60))));

        ReviewState retouche = port.find("people/alice", CycleKind.RETOUCHE).orElseThrow();
        assertThat(retouche.nextDueAt()).isEqualTo(NOW);
        assertThat(retouche.importance()).isEqualTo(ImportanceLevel.CRITICAL);
        ReviewState lecture = port.find("people/alice", CycleKind.LECTURE).orElseThrow();
        assertThat(lecture.nextDueAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(lecture.importance()).isEqualTo(ImportanceLevel.CRITICAL);
    }

    @Test
    void noteUnchangedSinceRetoucheKeepsSchedule() {
        Instant due = NOW.plus(Duration.ofHours(7));
        port.save(new ReviewState("people/alice", CycleKind.RETOUCHE, NoteType.PERSON, ImportanceLevel.NORMAL,
                2.3, 2, 12.0, due, NOW.minusSeconds(60), 2, 4));

        collaborator.process(List.of(note("people/alice", NoteType.PERSON, ImportanceLevel.NORMAL,
                NOW.minus(Duration.ofHours(3)))));

        assertThat(port.find("people/alice", CycleKind.RETOUCHE).orElseThrow().nextDueAt()).isEqualTo(due);
    }

    private static Note note(String id, NoteType type, ImportanceLevel importance, Instant updatedAt) {
        return new Note(id, id, "# " + id, type, importance, updatedAt);
    }
}
