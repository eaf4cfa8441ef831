package app.scapin.memory.analysis;

import app.scapin.memory.content.FrontMatter;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies approved actions to note content. STRUCTURE, SCORE and RESTRUCTURE_GRAPH are advisory
 * and leave the content as is.
 */
@Component
public class ActionApplier {

    static final String SUMMARY_PLACEHOLDER = "To be completed";
    static final String QUESTIONS_HEADING = "## Questions";

    public String apply(String content, List<ProposedAction> actions) {
        String result = content == null ? "" : content;
        for (ProposedAction action : actions) {
            if (action.applied()) {
                result = apply(result, action);
            }
        }
        return result;
    }

    public String apply(String content, ProposedAction action) {
        return switch (action.kind()) {
            case SUMMARIZE -> insertSummary(content, action.content());
            case ENRICH -> isBlank(action.content()) ? content : content.stripTrailing() + "\n\n" + action.content().strip() + "\n";
            case INJECT_QUESTIONS -> isBlank(action.content())
                    ? content
                    : content.stripTrailing() + "\n\n" + QUESTIONS_HEADING + "\n\n" + action.content().strip() + "\n";
            case STRUCTURE, SCORE, RESTRUCTURE_GRAPH -> content;
        };
    }

    private static String insertSummary(String content, String summary) {
        String line = "> **Summary**: " + (isBlank(summary) ? SUMMARY_PLACEHOLDER : summary.strip()) + "\n";
        FrontMatter frontMatter = FrontMatter.parse(content);
        if (frontMatter.block().isEmpty()) {
            return line + "\n" + content;
        }
        return frontMatter.block() + "\n" + line + frontMatter.body();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
