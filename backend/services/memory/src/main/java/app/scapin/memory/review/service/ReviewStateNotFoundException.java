package app.scapin.memory.review.service;

import app.scapin.memory.review.domain.CycleKind;

public class ReviewStateNotFoundException extends RuntimeException {

    public ReviewStateNotFoundException(String noteId, CycleKind cycle) {
        super("Review state not found: noteId=" + noteId + " cycle=" + cycle);
    }
}
