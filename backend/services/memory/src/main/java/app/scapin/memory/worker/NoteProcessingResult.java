package app.scapin.memory.worker;

import app.scapin.memory.analysis.ProposedAction;
import app.scapin.memory.review.domain.CycleKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one Retouche or Lecture pass.
 *
 * @param pendingActions actions below the auto-apply threshold, left for a human to confirm
 */
public record NoteProcessingResult(
        String noteId,
        CycleKind cycle,
        int qualityScore,
        int cycleQuality,
        String tierUsed,
        boolean escalated,
        int actionsApplied,
        List<ProposedAction> pendingActions,
        boolean contentUpdated,
        Instant nextDueAt,
        Duration duration
) {
    public NoteProcessingResult {
        pendingActions = pendingActions == null ? List.of() : List.copyOf(pendingActions);
    }

    public int actionsPending() {
        return pendingActions.size();
    }
}
