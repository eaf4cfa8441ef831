package app.scapin.memory.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the model answer into an {@link AnalysisResult}. Action {@code applied} flags are left
 * false; the pipeline decides them.
 */
@Component
public class AnalysisResponseParser {

    static final double DEFAULT_ACTION_CONFIDENCE = 0.5;
    static final double DEFAULT_OVERALL_CONFIDENCE = 0.8;

    private final ObjectMapper objectMapper;

    public AnalysisResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AnalysisResult parse(String text, AnalysisTier tier) {
        JsonNode root = readJson(text, tier);
        if (!root.isObject()) {
            throw new AnalysisTierException(tier, "Analysis answer is not a JSON object");
        }

        List<ProposedAction> actions = new ArrayList<>();
        JsonNode items = root.path("actions");
        if (items.isArray()) {
            for (JsonNode item : items) {
                if (!item.isObject()) {
                    continue;
                }
                actions.add(new ProposedAction(
                        ActionKind.fromString(item.path("type").asText(null)),
                        item.path("target").asText(""),
                        item.hasNonNull("content") ? item.get("content").asText() : null,
                        confidence(item.get("confidence"), DEFAULT_ACTION_CONFIDENCE),
                        item.path("reasoning").asText(""),
                        tier.label(),
                        false
                ));
            }
        }

        double overall;
        if (root.hasNonNull("confidence")) {
            overall = confidence(root.get("confidence"), DEFAULT_OVERALL_CONFIDENCE);
        } else if (!actions.isEmpty()) {
            overall = actions.stream().mapToDouble(ProposedAction::confidence).average().orElse(DEFAULT_OVERALL_CONFIDENCE);
        } else {
            overall = DEFAULT_OVERALL_CONFIDENCE;
        }

        String reasoning = root.path("reasoning").asText("Analysis complete");
        return new AnalysisResult(actions, overall, tier.label(), false, reasoning);
    }

    private JsonNode readJson(String text, AnalysisTier tier) {
        String json = extractJson(text);
        if (json == null) {
            throw new AnalysisTierException(tier, "Analysis answer has no JSON object");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new AnalysisTierException(tier, "Analysis answer is not valid JSON", ex);
        }
    }

    static String extractJson(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.strip();
        if (trimmed.startsWith("```")) {
            int firstBreak = trimmed.indexOf('\n');
            int fenceEnd = trimmed.lastIndexOf("```");
            if (firstBreak > 0 && fenceEnd > firstBreak) {
                trimmed = trimmed.substring(firstBreak + 1, fenceEnd).strip();
            }
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return trimmed.substring(start, end + 1);
    }

    private static double confidence(JsonNode node, double fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        double value = node.isNumber() ? node.asDouble() : parse(node.asText(), fallback);
        if (Double.isNaN(value)) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double parse(String value, double fallback) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
