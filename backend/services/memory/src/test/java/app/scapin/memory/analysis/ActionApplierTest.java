package app.scapin.memory.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActionApplierTest {

    private final ActionApplier applier = new ActionApplier();

    @Test
    void summaryIsInsertedAfterFrontMatter() {
        String content = """
                ---
                type: project
                ---
                # Atlas
                Body
                """;

        String updated = applier.apply(content, List.of(applied(ActionKind.SUMMARIZE, "Atlas ships in May")));

        assertThat(updated).startsWith("---\ntype: project\n---\n\n> **Summary**: Atlas ships in May\n# Atlas");
    }

    @Test
    void summaryWithoutFrontMatterGoesFirstWithPlaceholder() {
        String updated = applier.apply("# Atlas\n", List.of(applied(ActionKind.SUMMARIZE, null)));

        assertThat(updated).isEqualTo("> **Summary**: To be completed\n\n# Atlas\n");
    }

    @Test
    void enrichAndQuestionsAppend() {
        String updated = applier.apply("# Atlas\nBody\n\n", List.of(
                applied(ActionKind.ENRICH, "Extra context."),
                applied(ActionKind.INJECT_QUESTIONS, "- Who owns the budget?")
        ));

        assertThat(updated).isEqualTo("# Atlas\nBody\n\nExtra context.\n\n## Questions\n\n- Who owns the budget?\n");
    }

    @Test
    void advisoryAndPendingActionsLeaveContentUntouched() {
        String content = "# Atlas\nBody\n";
        List<ProposedAction> actions = List.of(
                applied(ActionKind.STRUCTURE, "## Goals"),
                applied(ActionKind.SCORE, null),
                applied(ActionKind.RESTRUCTURE_GRAPH, "merge"),
                new ProposedAction(ActionKind.ENRICH, "", "ignored", 0.5, "", "fast", false)
        );

        assertThat(applier.apply(content, actions)).isEqualTo(content);
    }

    private static ProposedAction applied(ActionKind kind, String content) {
        return new ProposedAction(kind, "", content, 0.9, "", "fast", true);
    }
}
