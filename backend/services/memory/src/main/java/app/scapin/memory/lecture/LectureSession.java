package app.scapin.memory.lecture;

import app.scapin.memory.review.domain.NoteType;

import java.time.Instant;
import java.util.List;

public record LectureSession(
        String sessionId,
        String noteId,
        String noteTitle,
        String noteContent,
        NoteType noteType,
        Instant startedAt,
        int lectureCount,
        Instant lastLectureAt,
        List<String> questions
) {
    public LectureSession {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
