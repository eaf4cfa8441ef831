package app.scapin.memory.analysis;

import java.time.Duration;

/**
 * Language-model backend called once per tier.
 */
public interface AnalysisBackend {

    /**
     * @throws AnalysisTierException on timeout, transport failure or an empty answer
     */
    BackendResponse invoke(String prompt, AnalysisTier tier, int maxTokens, Duration timeout);

    default boolean isAvailable() {
        return true;
    }
}
