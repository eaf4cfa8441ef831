package app.scapin.memory.worker.ingestion;

import app.scapin.memory.content.Note;
import app.scapin.memory.review.domain.CycleKind;
import app.scapin.memory.review.domain.ReviewState;
import app.scapin.memory.review.service.Sm2Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Schedules an immediate Retouche for notes edited after their last Retouche.
 */
@Component
public class RetoucheIngestionCollaborator implements IngestionCollaborator {

    private static final Logger log = LoggerFactory.getLogger(RetoucheIngestionCollaborator.class);

    private final Sm2Scheduler scheduler;

    public RetoucheIngestionCollaborator(Sm2Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void process(List<Note> modifiedNotes) {
        int triggered = 0;
        for (Note note : modifiedNotes) {
            ReviewState state = scheduler.ensureScheduled(
                    note.noteId(), CycleKind.RETOUCHE, note.noteType(), note.importance(), null);
            scheduler.refreshImportance(note.noteId(), note.importance());

            if (state.lastCompletedAt() != null
                    && note.updatedAt() != null
                    && note.updatedAt().isAfter(state.lastCompletedAt())
                    && scheduler.triggerImmediate(note.noteId(), CycleKind.RETOUCHE)) {
                triggered++;
            }
        }
        log.debug("Ingestion sweep notes={} triggered={}", modifiedNotes.size(), triggered);
    }
}
