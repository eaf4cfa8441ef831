package app.scapin.memory.analysis;

import java.util.Locale;

public enum AnalysisTier {
    FAST, STANDARD, DEEP;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
