package app.scapin.memory.content;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read and write access to note content. The memory cycle never creates or deletes notes.
 */
public interface ContentStore {

    Optional<Note> get(String noteId);

    /**
     * Replaces the content of an existing note.
     *
     * @throws ContentStoreException if the note does not exist or cannot be written
     */
    void update(String noteId, String content);

    List<String> listNoteIds();

    /**
     * Notes whose last modification is strictly after {@code since}.
     */
    List<Note> modifiedSince(Instant since);

    void refreshIndex();
}
