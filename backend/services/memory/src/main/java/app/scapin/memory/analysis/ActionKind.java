package app.scapin.memory.analysis;

import java.util.Locale;

public enum ActionKind {
    ENRICH, STRUCTURE, SUMMARIZE, SCORE, INJECT_QUESTIONS, RESTRUCTURE_GRAPH;

    /**
     * Unknown or missing values fall back to SCORE, which never modifies content.
     */
    public static ActionKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return SCORE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ActionKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return SCORE;
    }
}
