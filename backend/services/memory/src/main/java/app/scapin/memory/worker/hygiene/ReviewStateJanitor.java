package app.scapin.memory.worker.hygiene;

import app.scapin.memory.content.ContentStore;
import app.scapin.memory.content.Note;
import app.scapin.memory.review.api.ReviewStatePort;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.service.Sm2Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reconciles review states with the content store. Notes without a Retouche state get one;
 * states whose note disappeared are reported and kept.
 */
@Component
public class ReviewStateJanitor {

    private static final Logger log = LoggerFactory.getLogger(ReviewStateJanitor.class);
    private static final int SCAN_LIMIT = 10_000;

    private final ContentStore contentStore;
    private final ReviewStatePort states;
    private final Sm2Scheduler scheduler;

    public ReviewStateJanitor(ContentStore contentStore, ReviewStatePort states, Sm2Scheduler scheduler) {
        this.contentStore = contentStore;
        this.states = states;
        this.scheduler = scheduler;
    }

    public HygieneReport sweep() {
        List<String> noteIds = contentStore.listNoteIds();
        List<ReviewState> known = states.listAll(SCAN_LIMIT);

        Set<String> withRetouche = known.stream()
                .filter(s -> s.cycle() == CycleKind.RETOUCHE)
                .map(ReviewState::noteId)
                .collect(Collectors.toSet());

        int created = 0;
        for (String noteId : noteIds) {
            if (withRetouche.contains(noteId)) {
                continue;
            }
            Optional<Note> note = contentStore.get(noteId);
            if (note.isEmpty()) {
                continue;
            }
            scheduler.ensureScheduled(noteId, CycleKind.RETOUCHE, note.get().noteType(), note.get().importance(), null);
            created++;
        }

        Set<String> present = new HashSet<>(noteIds);
        List<String> orphans = new ArrayList<>();
        for (ReviewState state : known) {
            if (!present.contains(state.noteId()) && !orphans.contains(state.noteId())) {
                orphans.add(state.noteId());
            }
        }
        if (!orphans.isEmpty()) {
            log.warn("Review states without note count={} sample={}", orphans.size(), orphans.subList(0, Math.min(5, orphans.size())));
        }

        HygieneReport report = new HygieneReport(noteIds.size(), created, orphans);
        log.info("Hygiene sweep complete notes={} created={} orphans={}", report.notesScanned(), created, orphans.size());
        return report;
    }
}
