package app.scapin.memory.analysis;

import app.scapin.memory.content.Note;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static app.scapin.memory.analysis.EscalationPipelineTest.words;
import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedAnalyzerTest {

    @Test
    void longNoteWithoutSummaryOrSectionsGetsSummaryAndStructure() {
        AnalysisResult result = RuleBasedAnalyzer.analyze(AnalysisContext.from(note(NoteType.OTHER,
                "First sentence of the note. " + words(600))));

        assertThat(result.tierUsed()).isEqualTo(AnalysisResult.RULES);
        assertThat(result.actions()).extracting(ProposedAction::kind)
                .containsExactly(ActionKind.SUMMARIZE, ActionKind.STRUCTURE, ActionKind.SCORE);
        assertThat(result.actions().get(0).content()).isEqualTo("First sentence of the note.");
        assertThat(result.actions().get(0).confidence()).isEqualTo(0.9);
        assertThat(result.confidence()).isBetween(0.75, 0.95);
    }

    @Test
    void shortNoteOnlyGetsScore() {
        AnalysisResult result = RuleBasedAnalyzer.analyze(AnalysisContext.from(note(NoteType.OTHER, "A short idea.")));

        assertThat(result.actions()).extracting(ProposedAction::kind).containsExactly(ActionKind.SCORE);
        assertThat(result.confidence()).isEqualTo(0.95);
    }

    @Test
    void thinSectionsAreFlaggedForEnrichment() {
        String content = """
                ## Context
                Only a few words here.

                ## Details
                %s
                """.formatted(words(40));

        AnalysisResult result = RuleBasedAnalyzer.analyze(AnalysisContext.from(note(NoteType.OTHER, content)));

        assertThat(result.actions()).filteredOn(a -> a.kind() == ActionKind.ENRICH)
                .extracting(ProposedAction::target)
                .containsExactly("Context");
    }

    @Test
    void missingTypeSectionsAreReported() {
        String content = """
                ## Objectifs
                %s
                """.formatted(words(30));

        AnalysisResult result = RuleBasedAnalyzer.analyze(AnalysisContext.from(note(NoteType.PROJECT, content)));

        assertThat(result.actions()).filteredOn(a -> a.kind() == ActionKind.STRUCTURE)
                .extracting(ProposedAction::target)
                .containsExactly("Next actions");
    }

    @Test
    void rulesNeverApplyActionsThemselves() {
        AnalysisResult result = RuleBasedAnalyzer.analyze(AnalysisContext.from(note(NoteType.PERSON, words(300))));

        assertThat(result.actions()).noneMatch(ProposedAction::applied);
    }

    private static Note note(NoteType type, String content) {
        return new Note("n", "N", content, type, ImportanceLevel.NORMAL, Instant.EPOCH);
    }
}
