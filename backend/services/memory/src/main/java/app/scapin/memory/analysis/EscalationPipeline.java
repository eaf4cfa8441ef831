package app.scapin.memory.analysis;

import app.scapin.memory.config.AnalysisProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Confidence-gated analysis: FAST first, STANDARD when FAST is unsure, DEEP when STANDARD is
 * still unsure. Each tier runs at most once. A failing tier is replaced by the rule-based
 * analysis, whose confidence is high enough to stop the escalation.
 */
@Service
public class EscalationPipeline {

    private static final Logger log = LoggerFactory.getLogger(EscalationPipeline.class);

    private final AnalysisBackend backend;
    private final AnalysisPromptBuilder promptBuilder;
    private final AnalysisResponseParser responseParser;
    private final AnalysisProps props;

    public EscalationPipeline(AnalysisBackend backend,
                              AnalysisPromptBuilder promptBuilder,
                              AnalysisResponseParser responseParser,
                              AnalysisProps props) {
        this.backend = backend;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.props = props;
    }

    public AnalysisResult analyze(AnalysisContext context) {
        String prompt = promptBuilder.build(context);

        AnalysisResult result = runTier(AnalysisTier.FAST, prompt, context);
        if (result.confidence() < props.fastConfidenceThreshold()) {
            log.info("Escalating analysis noteId={} tier={} confidence={}",
                    context.note().noteId(), AnalysisTier.STANDARD, result.confidence());
            result = runTier(AnalysisTier.STANDARD, prompt, context).withEscalated(true);

            if (result.confidence() < props.deepConfidenceThreshold()) {
                log.info("Escalating analysis noteId={} tier={} confidence={}",
                        context.note().noteId(), AnalysisTier.DEEP, result.confidence());
                result = runTier(AnalysisTier.DEEP, prompt, context).withEscalated(true);
            }
        }

        AnalysisResult decided = result.withActions(decide(result.actions()));
        log.debug("Analysis complete noteId={} tier={} confidence={} actions={} applied={}",
                context.note().noteId(), decided.tierUsed(), decided.confidence(),
                decided.actions().size(), decided.appliedActions().size());
        return decided;
    }

    /**
     * Quality score in [0, 100] of the note as analysed. Each pending action costs 5 points.
     */
    public int qualityScore(AnalysisContext context, AnalysisResult result) {
        int score = 50;
        score += Math.min(20, context.wordCount() / 50);
        if (context.hasSummary()) {
            score += 15;
        }
        score += Math.min(10, context.sectionCount() * 3);
        score += Math.min(10, context.linkCount() * 2);
        score -= 5 * result.pendingActions().size();
        return Math.max(0, Math.min(100, score));
    }

    public static int mapToCycleQuality(int score) {
        if (score >= 90) {
            return 5;
        }
        if (score >= 75) {
            return 4;
        }
        if (score >= 60) {
            return 3;
        }
        if (score >= 40) {
            return 2;
        }
        if (score >= 20) {
            return 1;
        }
        return 0;
    }

    boolean isAutoApplicable(ProposedAction action) {
        double threshold = action.kind() == ActionKind.RESTRUCTURE_GRAPH
                ? props.restructureThreshold()
                : props.autoApplyThreshold();
        return action.confidence() >= threshold;
    }

    private List<ProposedAction> decide(List<ProposedAction> actions) {
        return actions.stream()
                .map(a -> a.withApplied(isAutoApplicable(a)))
                .toList();
    }

    private AnalysisResult runTier(AnalysisTier tier, String prompt, AnalysisContext context) {
        String noteId = context.note().noteId();
        try {
            if (!backend.isAvailable()) {
                throw new AnalysisTierException(tier, "Analysis backend unavailable");
            }
            BackendResponse response = backend.invoke(prompt, tier, props.maxTokens(), props.tierTimeout());
            AnalysisResult result = responseParser.parse(response.text(), tier);
            log.debug("Tier answered noteId={} tier={} confidence={} tokens={}",
                    noteId, tier, result.confidence(), response.tokensUsed());
            return result;
        } catch (AnalysisTierException ex) {
            log.warn("Analysis tier failed noteId={} tier={} message={}", noteId, tier, safeMessage(ex));
        } catch (RuntimeException ex) {
            log.warn("Analysis tier failed noteId={} tier={} errorType={} message={}",
                    noteId, tier, ex.getClass().getSimpleName(), safeMessage(ex));
        }
        return RuleBasedAnalyzer.analyze(context);
    }

    static String safeMessage(Exception ex) {
        if (ex == null || ex.getMessage() == null) {
            return "";
        }
        String trimmed = ex.getMessage().replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
