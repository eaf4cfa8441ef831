package app.scapin.memory.analysis;

import java.util.Objects;

public record ProposedAction(
        ActionKind kind,
        String target,
        String content,
        double confidence,
        String rationale,
        String tierUsed,
        boolean applied
) {
    public ProposedAction {
        Objects.requireNonNull(kind, "kind");
        target = target == null ? "" : target;
        rationale = rationale == null ? "" : rationale;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public ProposedAction withApplied(boolean value) {
        return new ProposedAction(kind, target, content, confidence, rationale, tierUsed, value);
    }
}
