package app.scapin.memory.review.domain;

import java.util.Locale;
import java.util.Map;

public enum NoteType {
    ENTITY(new ReviewConfig(12.0, 90, 2.5, true, false, false)),
    EVENT(new ReviewConfig(24.0, 180, 2.5, false, false, false)),
    PERSON(new ReviewConfig(2.0, 30, 2.3, true, false, false)),
    PROCESS(new ReviewConfig(48.0, 120, 2.5, true, false, false)),
    PROJECT(new ReviewConfig(2.0, 14, 2.0, true, false, false)),
    MEETING(new ReviewConfig(12.0, 60, 2.4, true, false, false)),
    MEMORY(new ReviewConfig(0.0, 0, 2.5, false, false, true)),
    OTHER(new ReviewConfig(24.0, 60, 2.5, false, false, false));

    private static final Map<String, NoteType> FOLDERS = Map.ofEntries(
            Map.entry("entities", ENTITY),
            Map.entry("entites", ENTITY),
            Map.entry("entités", ENTITY),
            Map.entry("events", EVENT),
            Map.entry("evenements", EVENT),
            Map.entry("événements", EVENT),
            Map.entry("people", PERSON),
            Map.entry("personnes", PERSON),
            Map.entry("processes", PROCESS),
            Map.entry("processus", PROCESS),
            Map.entry("projects", PROJECT),
            Map.entry("projets", PROJECT),
            Map.entry("meetings", MEETING),
            Map.entry("reunions", MEETING),
            Map.entry("réunions", MEETING),
            Map.entry("memories", MEMORY),
            Map.entry("souvenirs", MEMORY)
    );

    private final ReviewConfig reviewConfig;

    NoteType(ReviewConfig reviewConfig) {
        this.reviewConfig = reviewConfig;
    }

    public ReviewConfig reviewConfig() {
        return reviewConfig;
    }

    public boolean isReviewable() {
        return !reviewConfig.skipRevision();
    }

    public static NoteType fromFolder(String folderName) {
        if (folderName == null || folderName.isBlank()) {
            return OTHER;
        }
        return FOLDERS.getOrDefault(folderName.trim().toLowerCase(Locale.ROOT), OTHER);
    }

    /**
     * Walks the path segments and returns the first one naming a known folder.
     */
    public static NoteType fromPath(String path) {
        if (path == null) {
            return OTHER;
        }
        for (String part : path.replace('\\', '/').split("/")) {
            NoteType type = fromFolder(part);
            if (type != OTHER) {
                return type;
            }
        }
        return OTHER;
    }

    public static NoteType fromString(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (NoteType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return fromFolder(value);
    }
}
