package app.scapin.memory.analysis.provider.claude;

import app.scapin.memory.analysis.AnalysisBackend;
import app.scapin.memory.analysis.AnalysisPromptBuilder;
import app.scapin.memory.analysis.AnalysisTier;
import app.scapin.memory.analysis.AnalysisTierException;
import app.scapin.memory.analysis.BackendResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Anthropic Messages API backend. One model per tier; the tier timeout bounds the HTTP read.
 */
@Component
public class ClaudeAnalysisBackend implements AnalysisBackend {

    private static final Logger log = LoggerFactory.getLogger(ClaudeAnalysisBackend.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final ClaudeProps props;

    public ClaudeAnalysisBackend(RestClient.Builder restClientBuilder,
                                 ClaudeProps props,
                                 ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.baseUrl(props.baseUrl()).build();
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public boolean isAvailable() {
        return props.hasApiKey();
    }

    @Override
    public BackendResponse invoke(String prompt, AnalysisTier tier, int maxTokens, Duration timeout) {
        if (!props.hasApiKey()) {
            throw new AnalysisTierException(tier, "Anthropic API key is not configured");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", props.modelFor(tier));
        payload.put("max_tokens", Math.max(maxTokens, 1));
        payload.put("system", AnalysisPromptBuilder.SYSTEM_PROMPT);

        ArrayNode messages = payload.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", prompt);

        JsonNode response;
        try {
            response = withTimeout(timeout).post()
                    .uri("/v1/messages")
                    .header("x-api-key", props.apiKey())
                    .header("anthropic-version", props.apiVersion())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new AnalysisTierException(tier, "Anthropic call failed: " + ex.getClass().getSimpleName(), ex);
        }

        return toBackendResponse(ClaudeResponseParser.read(response), tier);
    }

    static BackendResponse toBackendResponse(ClaudeAnswer answer, AnalysisTier tier) {
        if (answer.error() != null) {
            throw new AnalysisTierException(tier, "Anthropic error " + answer.error());
        }
        if (answer.truncated()) {
            throw new AnalysisTierException(tier, "Anthropic answer cut at max_tokens tokens=" + answer.tokensUsed());
        }
        if (!answer.hasText()) {
            throw new AnalysisTierException(tier, "Anthropic response has no text");
        }
        if (answer.skippedBlocks() > 0) {
            log.debug("Ignored non-text blocks tier={} count={}", tier, answer.skippedBlocks());
        }
        return new BackendResponse(answer.text(), answer.tokensUsed());
    }

    private RestClient withTimeout(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(CONNECT_TIMEOUT);
        factory.setReadTimeout(timeout);
        return restClient.mutate().requestFactory(factory).build();
    }
}
