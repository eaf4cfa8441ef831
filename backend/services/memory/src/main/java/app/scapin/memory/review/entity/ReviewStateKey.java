package app.scapin.memory.review.entity;

import app.scapin.memory.review.domain.CycleKind;

import java.io.Serializable;
import java.util.Objects;

public class ReviewStateKey implements Serializable {

    private String noteId;
    private CycleKind cycle;

    public ReviewStateKey() {
    }

    public ReviewStateKey(String noteId, CycleKind cycle) {
        this.noteId = noteId;
        this.cycle = cycle;
    }

    public String getNoteId() {
        return noteId;
    }

    public CycleKind getCycle() {
        return cycle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReviewStateKey that)) return false;
        return Objects.equals(noteId, that.noteId) && cycle == that.cycle;
    }

    @Override
    public int hashCode() {
        return Objects.hash(noteId, cycle);
    }
}
