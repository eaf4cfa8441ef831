package app.scapin.memory.analysis.provider.claude;

import app.scapin.memory.analysis.AnalysisTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.memory.anthropic")
public record ClaudeProps(
        @DefaultValue("https://api.anthropic.com") String baseUrl,
        @DefaultValue("2023-06-01") String apiVersion,
        String apiKey,
        @DefaultValue("claude-3-5-haiku-latest") String fastModel,
        @DefaultValue("claude-sonnet-4-5") String standardModel,
        @DefaultValue("claude-opus-4-1") String deepModel
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String modelFor(AnalysisTier tier) {
        return switch (tier) {
            case FAST -> fastModel;
            case STANDARD -> standardModel;
            case DEEP -> deepModel;
        };
    }
}
