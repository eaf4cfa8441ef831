package app.scapin.memory.analysis;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class AnalysisPromptBuilder {

    public static final String SYSTEM_PROMPT = """
            You review notes of a personal knowledge base and propose improvements.
            Allowed action types: enrich, structure, summarize, score, inject_questions, restructure_graph.
            Answer with a single JSON object and nothing else:
            {
              "confidence": <0..1, how sure you are of the whole analysis>,
              "reasoning": "<one sentence>",
              "actions": [
                {"type": "<action type>", "target": "<section or element>", "content": "<text to add, optional>",
                 "confidence": <0..1>, "reasoning": "<why>"}
              ]
            }
            Only propose content you can support from the note itself.
            """;

    private static final int MAX_CONTENT_CHARS = 12_000;
    private static final Pattern MARKDOWN_MEDIA = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]+\\)");
    private static final Pattern HTML_IMAGE = Pattern.compile("<img[^>]+src=[\"'][^\"']+[\"'][^>]*>");

    public String build(AnalysisContext context) {
        String content = scrub(context.body());
        if (content.length() > MAX_CONTENT_CHARS) {
            content = content.substring(0, MAX_CONTENT_CHARS) + "\n[TRUNCATED]";
        }
        return """
                Note: %s
                Type: %s
                Importance: %s
                Words: %d
                Sections: %d
                Has summary: %s
                Links: %d
                Open questions: %d

                Content:
                %s
                """.formatted(
                context.note().title(),
                context.note().noteType().name(),
                context.note().importance().name(),
                context.wordCount(),
                context.sectionCount(),
                context.hasSummary() ? "yes" : "no",
                context.linkCount(),
                context.questionCount(),
                content
        );
    }

    static String scrub(String content) {
        String scrubbed = MARKDOWN_MEDIA.matcher(content).replaceAll("[MEDIA: $1]");
        return HTML_IMAGE.matcher(scrubbed).replaceAll("[IMAGE]");
    }
}
