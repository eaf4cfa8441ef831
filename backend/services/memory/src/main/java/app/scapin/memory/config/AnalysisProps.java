package app.scapin.memory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.memory.analysis")
public record AnalysisProps(
        @DefaultValue("0.7") double fastConfidenceThreshold,
        @DefaultValue("0.5") double deepConfidenceThreshold,
        @DefaultValue("0.85") double autoApplyThreshold,
        @DefaultValue("0.95") double restructureThreshold,
        @DefaultValue("30") int tierTimeoutSeconds,
        @DefaultValue("2048") int maxTokens
) {

    public AnalysisProps {
        fastConfidenceThreshold = clampUnit(fastConfidenceThreshold);
        deepConfidenceThreshold = Math.min(clampUnit(deepConfidenceThreshold), fastConfidenceThreshold);
        autoApplyThreshold = clampUnit(autoApplyThreshold);
        restructureThreshold = Math.max(clampUnit(restructureThreshold), autoApplyThreshold);
        tierTimeoutSeconds = Math.max(tierTimeoutSeconds, 1);
        maxTokens = Math.max(maxTokens, 1);
    }

    public static AnalysisProps defaults() {
        return new AnalysisProps(0.7, 0.5, 0.85, 0.95, 30, 2048);
    }

    public Duration tierTimeout() {
        return Duration.ofSeconds(tierTimeoutSeconds);
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
