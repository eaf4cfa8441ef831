package app.scapin.memory.content;

import app.scapin.memory.config.NotesProps;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Notes stored as {@code *.md} files below a root directory. The note id is the path relative to
 * the root, with forward slashes and without the extension.
 */
@Component
public class MarkdownDirectoryContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(MarkdownDirectoryContentStore.class);
    private static final String EXTENSION = ".md";

    private final Path root;
    private final Map<String, Path> index = new ConcurrentHashMap<>();

    public MarkdownDirectoryContentStore(NotesProps props) {
        this.root = Path.of(props.directory()).toAbsolutePath().normalize();
    }

    @Override
    public Optional<Note> get(String noteId) {
        Optional<Path> path = resolve(noteId);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(noteId, path.get()));
        } catch (IOException ex) {
            throw new ContentStoreException("Cannot read note " + noteId, ex);
        }
    }

    @Override
    public void update(String noteId, String content) {
        Path path = resolve(noteId)
                .orElseThrow(() -> new ContentStoreException("Note not found: " + noteId));
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content == null ? "" : content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new ContentStoreException("Cannot write note " + noteId, ex);
        }
        log.debug("Note updated noteId={}", noteId);
    }

    @Override
    public List<String> listNoteIds() {
        if (index.isEmpty()) {
            refreshIndex();
        }
        return index.keySet().stream().sorted().toList();
    }

    @Override
    public List<Note> modifiedSince(Instant since) {
        refreshIndex();
        List<Note> modified = new ArrayList<>();
        for (Map.Entry<String, Path> entry : index.entrySet()) {
            try {
                Instant lastModified = Files.getLastModifiedTime(entry.getValue()).toInstant();
                if (since == null || lastModified.isAfter(since)) {
                    modified.add(read(entry.getKey(), entry.getValue()));
                }
            } catch (IOException ex) {
                log.warn("Skipping unreadable note noteId={} error={}", entry.getKey(), ex.getClass().getSimpleName());
            }
        }
        modified.sort(Comparator.comparing(Note::updatedAt));
        return modified;
    }

    @Override
    public void refreshIndex() {
        if (!Files.isDirectory(root)) {
            log.warn("Notes directory missing path={}", root);
            index.clear();
            return;
        }
        Map<String, Path> scanned = new ConcurrentHashMap<>();
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .filter(p -> !isHidden(root.relativize(p)))
                    .forEach(p -> scanned.put(toNoteId(p), p));
        } catch (IOException ex) {
            throw new ContentStoreException("Cannot scan notes directory " + root, ex);
        }
        index.keySet().retainAll(scanned.keySet());
        index.putAll(scanned);
        log.debug("Note index refreshed notes={}", index.size());
    }

    private Optional<Path> resolve(String noteId) {
        if (noteId == null || noteId.isBlank()) {
            return Optional.empty();
        }
        Path indexed = index.get(noteId);
        if (indexed != null && Files.isRegularFile(indexed)) {
            return Optional.of(indexed);
        }
        Path candidate = root.resolve(noteId + EXTENSION).normalize();
        if (!candidate.startsWith(root) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        index.put(noteId, candidate);
        return Optional.of(candidate);
    }

    private Note read(String noteId, Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        FrontMatter frontMatter = FrontMatter.parse(content);

        String typeValue = frontMatter.string("type");
        NoteType type = typeValue == null ? NoteType.fromPath(noteId) : NoteType.fromString(typeValue);

        return new Note(
                noteId,
                title(frontMatter, path),
                content,
                type,
                ImportanceLevel.parse(frontMatter.string("importance")),
                Files.getLastModifiedTime(path).toInstant()
        );
    }

    private String toNoteId(Path path) {
        String relative = root.relativize(path).toString().replace('\\', '/');
        return relative.substring(0, relative.length() - EXTENSION.length());
    }

    private static String title(FrontMatter frontMatter, Path path) {
        String title = frontMatter.string("title");
        if (title != null && !title.isBlank()) {
            return title.trim();
        }
        for (String line : frontMatter.body().split("\n")) {
            if (line.startsWith("# ")) {
                return line.substring(2).trim();
            }
        }
        String fileName = path.getFileName().toString();
        return fileName.substring(0, fileName.length() - EXTENSION.length());
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
