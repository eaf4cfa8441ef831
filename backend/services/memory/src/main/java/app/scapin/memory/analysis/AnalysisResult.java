package app.scapin.memory.analysis;

import java.util.List;

/**
 * Outcome of analysing one note. {@code tierUsed} is the tier label, or {@value #RULES} when
 * the rule-based analysis produced the result.
 */
public record AnalysisResult(
        List<ProposedAction> actions,
        double confidence,
        String tierUsed,
        boolean escalated,
        String rationale
) {
    public static final String RULES = "rules";

    public AnalysisResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
        rationale = rationale == null ? "" : rationale;
    }

    public boolean isRuleBased() {
        return RULES.equals(tierUsed);
    }

    public List<ProposedAction> appliedActions() {
        return actions.stream().filter(ProposedAction::applied).toList();
    }

    public List<ProposedAction> pendingActions() {
        return actions.stream().filter(a -> !a.applied()).toList();
    }

    public AnalysisResult withActions(List<ProposedAction> updated) {
        return new AnalysisResult(updated, confidence, tierUsed, escalated, rationale);
    }

    public AnalysisResult withEscalated(boolean value) {
        return new AnalysisResult(actions, confidence, tierUsed, value, rationale);
    }
}
