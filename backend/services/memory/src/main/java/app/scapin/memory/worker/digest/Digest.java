package app.scapin.memory.worker.digest;

import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record Digest(LocalDate day, Instant generatedAt, List<Item> items, long totalDue) {

    public record Item(String noteId, String title, NoteType noteType, ImportanceLevel importance, Instant dueAt) {
    }

    public Digest {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
