package app.scapin.memory.analysis;

/**
 * Failure of a single analysis tier: timeout, transport error, unusable output or unavailable
 * backend. Never escapes {@link EscalationPipeline}.
 */
public class AnalysisTierException extends RuntimeException {

    private final AnalysisTier tier;

    public AnalysisTierException(AnalysisTier tier, String message) {
        super(message);
        this.tier = tier;
    }

    public AnalysisTierException(AnalysisTier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public AnalysisTier getTier() {
        return tier;
    }
}
