package app.scapin.memory.analysis.provider.claude;

/**
 * @param truncated the model stopped at {@code max_tokens}, so the JSON answer is likely incomplete
 * @param skippedBlocks content blocks that carried no text
 * @param error API error envelope as {@code type: message}, null on success
 */
record ClaudeAnswer(String text, int tokensUsed, boolean truncated, int skippedBlocks, String error) {

    static final ClaudeAnswer EMPTY = new ClaudeAnswer("", 0, false, 0, null);

    static ClaudeAnswer failed(String error) {
        return new ClaudeAnswer("", 0, false, 0, error);
    }

    boolean hasText() {
        return text != null && !text.isBlank();
    }
}
