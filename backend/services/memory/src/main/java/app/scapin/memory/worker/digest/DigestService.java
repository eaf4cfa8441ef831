package app.scapin.memory.worker.digest;

import app.scapin.memory.config.WorkerProps;
import app.scapin.memory.content.ContentStore;
import app.scapin.memory.content.Note;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.service.Sm2Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Morning list of notes waiting for a human Lecture.
 */
@Service
public class DigestService {

    private static final Logger log = LoggerFactory.getLogger(DigestService.class);

    private final Sm2Scheduler scheduler;
    private final ContentStore contentStore;
    private final WorkerProps props;
    private final Clock clock;

    public DigestService(Sm2Scheduler scheduler, ContentStore contentStore, WorkerProps props, Clock clock) {
        this.scheduler = scheduler;
        this.contentStore = contentStore;
        this.props = props;
        this.clock = clock;
    }

    public Digest generate() {
        Instant now = clock.instant();
        List<ReviewState> due = scheduler.getDue(props.digestMaxItems(), CycleKind.LECTURE);
        List<Digest.Item> items = due.stream()
                .map(state -> new Digest.Item(
                        state.noteId(),
                        contentStore.get(state.noteId()).map(Note::title).orElse(state.noteId()),
                        state.noteType(),
                        state.importance(),
                        state.nextDueAt()))
                .toList();
        long totalDue = scheduler.reviewStats(CycleKind.LECTURE).totalDue();

        Digest digest = new Digest(LocalDate.ofInstant(now, props.zoneId()), now, items, totalDue);
        log.info("Digest generated day={} items={} totalDue={}", digest.day(), items.size(), totalDue);
        return digest;
    }
}
