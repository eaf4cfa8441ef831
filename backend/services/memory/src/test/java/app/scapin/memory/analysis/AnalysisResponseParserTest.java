package app.scapin.memory.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisResponseParserTest {

    private final AnalysisResponseParser parser = new AnalysisResponseParser(new ObjectMapper());

    @Test
    void parsesFencedAnswerAndMapsUnknownTypesToScore() {
        String text = """
                Here is my analysis:
                ```json
                {"reasoning": "Needs a summary", "actions": [
                  {"type": "summarize", "target": "header", "content": "Atlas in one line", "confidence": 0.9},
                  {"type": "merge_into", "target": "other"}
                ]}
                ```
                """;

        AnalysisResult result = parser.parse(text, AnalysisTier.STANDARD);

        assertThat(result.tierUsed()).isEqualTo("standard");
        assertThat(result.rationale()).isEqualTo("Needs a summary");
        assertThat(result.actions()).extracting(ProposedAction::kind)
                .containsExactly(ActionKind.SUMMARIZE, ActionKind.SCORE);
        assertThat(result.actions().get(1).confidence()).isEqualTo(0.5);
        assertThat(result.confidence()).isEqualTo((0.9 + 0.5) / 2);
    }

    @Test
    void topLevelConfidenceWins() {
        AnalysisResult result = parser.parse("{\"confidence\": \"0.42\", \"actions\": [{\"type\": \"enrich\", \"confidence\": 0.9}]}",
                AnalysisTier.FAST);

        assertThat(result.confidence()).isEqualTo(0.42);
    }

    @Test
    void answerWithoutActionsDefaultsConfidence() {
        AnalysisResult result = parser.parse("{}", AnalysisTier.FAST);

        assertThat(result.actions()).isEmpty();
        assertThat(result.confidence()).isEqualTo(0.8);
    }

    @Test
    void confidenceIsClampedToUnitRange() {
        AnalysisResult result = parser.parse("{\"confidence\": 7, \"actions\": [{\"type\": \"score\", \"confidence\": -2}]}",
                AnalysisTier.FAST);

        assertThat(result.confidence()).isEqualTo(1.0);
        assertThat(result.actions().get(0).confidence()).isZero();
    }

    @Test
    void rejectsAnswersWithoutJson() {
        assertThatThrownBy(() -> parser.parse("no json here", AnalysisTier.DEEP))
                .isInstanceOf(AnalysisTierException.class)
                .extracting(ex -> ((AnalysisTierException) ex).getTier())
                .isEqualTo(AnalysisTier.DEEP);
        assertThatThrownBy(() -> parser.parse("{broken", AnalysisTier.FAST))
                .isInstanceOf(AnalysisTierException.class);
        assertThatThrownBy(() -> parser.parse("{\"a\": }", AnalysisTier.FAST))
                .isInstanceOf(AnalysisTierException.class);
    }
}
