package app.scapin.memory.lecture;

import java.time.Instant;

public record LectureResult(
        String noteId,
        int quality,
        Instant nextLectureAt,
        double intervalHours,
        int answersRecorded
) {
}
