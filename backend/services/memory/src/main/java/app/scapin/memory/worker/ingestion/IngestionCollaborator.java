package app.scapin.memory.worker.ingestion;

import app.scapin.memory.content.Note;

import java.util.List;

/**
 * Handles notes changed outside the memory cycle since the previous sweep.
 */
public interface IngestionCollaborator {

    void process(List<Note> modifiedNotes);
}
