package app.scapin.memory.worker.hygiene;

import java.util.List;

public record HygieneReport(int notesScanned, int statesCreated, List<String> orphanNoteIds) {

    public HygieneReport {
        orphanNoteIds = orphanNoteIds == null ? List.of() : List.copyOf(orphanNoteIds);
    }
}
