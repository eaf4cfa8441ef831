package app.scapin.memory.analysis;

import app.scapin.memory.config.AnalysisProps;
import app.scapin.memory.content.Note;
import app.scapin.memory.review.domain.ImportanceLevel;
import app.scapin.memory.review.domain.NoteType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EscalationPipelineTest {

    @Mock
    AnalysisBackend backend;

    EscalationPipeline pipeline;

    @BeforeEach
    void setup() {
        lenient().when(backend.isAvailable()).thenReturn(true);
        pipeline = new EscalationPipeline(
                backend,
                new AnalysisPromptBuilder(),
                new AnalysisResponseParser(new ObjectMapper()),
                AnalysisProps.defaults()
        );
    }

    @Test
    void confidentFastTierStopsThere() {
        answer(AnalysisTier.FAST, 0.9);

        AnalysisResult result = pipeline.analyze(context(note("Short note")));

        assertThat(result.tierUsed()).isEqualTo("fast");
        assertThat(result.escalated()).isFalse();
        verify(backend, times(1)).invoke(anyString(), any(), anyInt(), any());
    }

    @Test
    void escalatesToStandardButNotDeepWhenStandardIsAboveDeepThreshold() {
        answer(AnalysisTier.FAST, 0.6);
        answer(AnalysisTier.STANDARD, 0.55);

        AnalysisResult result = pipeline.analyze(context(note("Some note")));

        assertThat(result.tierUsed()).isEqualTo("standard");
        assertThat(result.escalated()).isTrue();
        assertThat(result.confidence()).isEqualTo(0.55);
        verify(backend, never()).invoke(anyString(), eq(AnalysisTier.DEEP), anyInt(), any());
    }

    @Test
    void runsEachTierAtMostOnce() {
        answer(AnalysisTier.FAST, 0.3);
        answer(AnalysisTier.STANDARD, 0.2);
        answer(AnalysisTier.DEEP, 0.1);

        AnalysisResult result = pipeline.analyze(context(note("Some note")));

        assertThat(result.tierUsed()).isEqualTo("deep");
        assertThat(result.escalated()).isTrue();
        verify(backend, times(3)).invoke(anyString(), any(), anyInt(), any());
        verify(backend).invoke(anyString(), eq(AnalysisTier.FAST), eq(2048), eq(Duration.ofSeconds(30)));
    }

    @Test
    void failingTierFallsBackToRulesWithoutFurtherEscalation() {
        when(backend.invoke(anyString(), eq(AnalysisTier.FAST), anyInt(), any()))
                .thenThrow(new AnalysisTierException(AnalysisTier.FAST, "timeout"));

        AnalysisResult result = pipeline.analyze(context(note(words(250))));

        assertThat(result.isRuleBased()).isTrue();
        assertThat(result.confidence()).isBetween(0.75, 0.95);
        assertThat(result.escalated()).isFalse();
        assertThat(result.actions()).extracting(ProposedAction::kind).contains(ActionKind.SUMMARIZE, ActionKind.SCORE);
        verify(backend, times(1)).invoke(anyString(), any(), anyInt(), any());
    }

    @Test
    void failureAfterEscalationKeepsEscalatedFlag() {
        answer(AnalysisTier.FAST, 0.6);
        when(backend.invoke(anyString(), eq(AnalysisTier.STANDARD), anyInt(), any()))
                .thenThrow(new IllegalStateException("connection reset"));

        AnalysisResult result = pipeline.analyze(context(note("Some note")));

        assertThat(result.isRuleBased()).isTrue();
        assertThat(result.escalated()).isTrue();
        verify(backend, never()).invoke(anyString(), eq(AnalysisTier.DEEP), anyInt(), any());
    }

    @Test
    void unparsableAnswerCountsAsTierFailure() {
        when(backend.invoke(anyString(), eq(AnalysisTier.FAST), anyInt(), any()))
                .thenReturn(new BackendResponse("I cannot answer that", 12));

        AnalysisResult result = pipeline.analyze(context(note("Some note")));

        assertThat(result.isRuleBased()).isTrue();
    }

    @Test
    void unavailableBackendIsNeverCalled() {
        when(backend.isAvailable()).thenReturn(false);

        AnalysisResult result = pipeline.analyze(context(note("Some note")));

        assertThat(result.isRuleBased()).isTrue();
        verify(backend, never()).invoke(anyString(), any(), anyInt(), any());
    }

    @Test
    void autoApplyUsesStricterThresholdForGraphRestructuring() {
        when(backend.invoke(anyString(), eq(AnalysisTier.FAST), anyInt(), any())).thenReturn(new BackendResponse("""
                {"confidence": 0.9, "actions": [
                  {"type": "summarize", "content": "Short", "confidence": 0.9},
                  {"type": "restructure_graph", "confidence": 0.9},
                  {"type": "restructure_graph", "confidence": 0.96},
                  {"type": "enrich", "content": "More", "confidence": 0.84}
                ]}
                """, 100));

        AnalysisResult result = pipeline.analyze(context(note("Some note")));

        assertThat(result.actions()).extracting(ProposedAction::applied)
                .containsExactly(true, false, true, false);
        assertThat(result.pendingActions()).hasSize(2);
    }

    @Test
    void qualityScoreCombinesContentSignalsAndPendingPenalty() {
        String content = """
                # Atlas

                ## Summary
                %s

                ## Links
                [[Alice]] [[Bob]] [[Alice]]
                """.formatted(words(500));
        AnalysisContext context = context(note(content));
        ProposedAction pending = new ProposedAction(ActionKind.STRUCTURE, "", null, 0.5, "", "fast", false);
        AnalysisResult result = new AnalysisResult(List.of(pending), 0.9, "fast", false, "");

        int score = pipeline.qualityScore(context, result);

        // 510 words, summary, 2 sections, 2 distinct links, 1 pending
        assertThat(score).isEqualTo(50 + 10 + 15 + 6 + 4 - 5);
    }

    @Test
    void qualityScoreIsClamped() {
        AnalysisContext context = context(note(""));
        List<ProposedAction> pending = java.util.Collections.nCopies(20,
                new ProposedAction(ActionKind.ENRICH, "", null, 0.1, "", "fast", false));

        assertThat(pipeline.qualityScore(context, new AnalysisResult(pending, 0.1, "fast", false, ""))).isZero();
    }

    @Test
    void cycleQualityMappingIsMonotonicWithExpectedBounds() {
        assertThat(EscalationPipeline.mapToCycleQuality(100)).isEqualTo(5);
        assertThat(EscalationPipeline.mapToCycleQuality(90)).isEqualTo(5);
        assertThat(EscalationPipeline.mapToCycleQuality(89)).isEqualTo(4);
        assertThat(EscalationPipeline.mapToCycleQuality(75)).isEqualTo(4);
        assertThat(EscalationPipeline.mapToCycleQuality(60)).isEqualTo(3);
        assertThat(EscalationPipeline.mapToCycleQuality(40)).isEqualTo(2);
        assertThat(EscalationPipeline.mapToCycleQuality(20)).isEqualTo(1);
        assertThat(EscalationPipeline.mapToCycleQuality(19)).isZero();
        assertThat(EscalationPipeline.mapToCycleQuality(0)).isZero();

        int previous = 0;
        for (int score = 0; score <= 100; score++) {
            int quality = EscalationPipeline.mapToCycleQuality(score);
            assertThat(quality).isBetween(0, 5).isGreaterThanOrEqualTo(previous);
            previous = quality;
        }
    }

    private void answer(AnalysisTier tier, double confidence) {
        when(backend.invoke(anyString(), eq(tier), anyInt(), any()))
                .thenReturn(new BackendResponse("{\"confidence\": " + confidence + ", \"actions\": []}", 50));
    }

    static AnalysisContext context(Note note) {
        return AnalysisContext.from(note);
    }

    static Note note(String content) {
        return new Note("projects/atlas", "Atlas", content, NoteType.PROJECT, ImportanceLevel.NORMAL,
                Instant.parse("2025-03-10T08:00:00Z"));
    }

    static String words(int count) {
        return String.join(" ", java.util.Collections.nCopies(count, "word"));
    }
}
