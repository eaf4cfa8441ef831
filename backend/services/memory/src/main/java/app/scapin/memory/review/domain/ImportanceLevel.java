package app.scapin.memory.review.domain;

import java.util.Locale;

public enum ImportanceLevel {
    CRITICAL(0), HIGH(1), NORMAL(2), LOW(3), ARCHIVE(4);

    private final int rank;
    ImportanceLevel(int rank) { this.rank = rank; }
    public int rank() { return rank; }

    public boolean isSelectable() {
        return this != ARCHIVE;
    }

    public static ImportanceLevel fromRank(int rank) {
        for (ImportanceLevel level : values()) {
            if (level.rank == rank) {
                return level;
            }
        }
        return NORMAL;
    }

    /**
     * Accepts the English names and the French front matter values; anything else is NORMAL.
     */
    public static ImportanceLevel parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "critique" -> CRITICAL;
            case "high", "haute" -> HIGH;
            case "low", "basse" -> LOW;
            case "archive" -> ARCHIVE;
            default -> NORMAL;
        };
    }
}
