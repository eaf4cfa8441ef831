package app.scapin.memory.analysis;

public record BackendResponse(String text, int tokensUsed) {
}
