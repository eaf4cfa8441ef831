package app.scapin.memory.content;

import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;

import java.time.Instant;
import java.util.Objects;

public record Note(
        String noteId,
        String title,
        String content,
        NoteType noteType,
        ImportanceLevel importance,
        Instant updatedAt
) {
    public Note {
        Objects.requireNonNull(noteId, "noteId");
        title = title == null ? noteId : title;
        content = content == null ? "" : content;
        noteType = noteType == null ? NoteType.OTHER : noteType;
        importance = importance == null ? ImportanceLevel.NORMAL : importance;
    }
}
