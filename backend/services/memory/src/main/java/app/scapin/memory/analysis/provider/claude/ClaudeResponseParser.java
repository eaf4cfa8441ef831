package app.scapin.memory.analysis.provider.claude;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads a Messages API body into a {@link ClaudeAnswer}. The analysis answer is one JSON object the
 * model may split over several text blocks, so blocks are concatenated as is.
 */
final class ClaudeResponseParser {

    static final String STOP_MAX_TOKENS = "max_tokens";

    private ClaudeResponseParser() {
    }

    static ClaudeAnswer read(JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            return ClaudeAnswer.EMPTY;
        }
        if ("error".equals(body.path("type").asText())) {
            JsonNode error = body.path("error");
            return ClaudeAnswer.failed(error.path("type").asText("error") + ": " + error.path("message").asText(""));
        }

        StringBuilder answer = new StringBuilder();
        int skipped = 0;
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                answer.append(block.get("text").asText());
            } else {
                skipped++;
            }
        }
        JsonNode usage = body.path("usage");
        int tokens = usage.path("input_tokens").asInt(0) + usage.path("output_tokens").asInt(0);
        boolean truncated = STOP_MAX_TOKENS.equals(body.path("stop_reason").asText());
        return new ClaudeAnswer(answer.toString().strip(), tokens, truncated, skipped, null);
    }
}
