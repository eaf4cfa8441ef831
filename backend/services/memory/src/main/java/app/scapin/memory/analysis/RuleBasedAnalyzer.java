package app.scapin.memory.analysis;

import app.scapin.memory.review.domain.NoteType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic analysis used when no tier produced a usable answer.
 */
public final class RuleBasedAnalyzer {

    static final double MIN_CONFIDENCE = 0.75;
    static final double MAX_CONFIDENCE = 0.95;

    private static final int SUMMARY_MIN_WORDS = 200;
    private static final int STRUCTURE_MIN_WORDS = 500;
    private static final int THIN_SECTION_WORDS = 20;
    private static final int MAX_THIN_SECTIONS = 5;
    private static final int MAX_SUMMARY_CHARS = 200;

    private static final Map<NoteType, List<List<String>>> REQUIRED_SECTIONS = Map.of(
            NoteType.PERSON, List.of(List.of("Contact", "Coordonnées")),
            NoteType.PROJECT, List.of(List.of("Goals", "Objectifs"), List.of("Next actions", "Prochaines actions")),
            NoteType.MEETING, List.of(List.of("Decisions", "Décisions"), List.of("Action items", "Actions")),
            NoteType.PROCESS, List.of(List.of("Steps", "Étapes")),
            NoteType.EVENT, List.of(List.of("Date"))
    );

    private RuleBasedAnalyzer() {
    }

    public static AnalysisResult analyze(AnalysisContext context) {
        List<ProposedAction> actions = new ArrayList<>();

        if (!context.hasSummary() && context.wordCount() > SUMMARY_MIN_WORDS) {
            actions.add(action(ActionKind.SUMMARIZE, "header", firstSentence(context.body()), 0.9,
                    "Note has enough content but no summary"));
        }

        if (context.wordCount() > STRUCTURE_MIN_WORDS && context.sectionCount() < 2) {
            actions.add(action(ActionKind.STRUCTURE, "content", null, 0.8, "Long content with few sections"));
        }

        int thin = 0;
        for (AnalysisContext.Section section : context.sections()) {
            if (section.wordCount() < THIN_SECTION_WORDS && thin < MAX_THIN_SECTIONS) {
                actions.add(action(ActionKind.ENRICH, section.heading(), null, 0.75,
                        "Section has fewer than " + THIN_SECTION_WORDS + " words"));
                thin++;
            }
        }

        for (List<String> aliases : REQUIRED_SECTIONS.getOrDefault(context.note().noteType(), List.of())) {
            boolean present = aliases.stream().anyMatch(context::hasSection);
            if (!present) {
                actions.add(action(ActionKind.STRUCTURE, aliases.get(0), "## " + aliases.get(0), 0.8,
                        "Missing section expected for " + context.note().noteType().name().toLowerCase(Locale.ROOT)));
            }
        }

        actions.add(action(ActionKind.SCORE, "quality", null, 0.95, "Quality assessment"));

        double mean = actions.stream().mapToDouble(ProposedAction::confidence).average().orElse(MIN_CONFIDENCE);
        double confidence = Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, mean));
        return new AnalysisResult(actions, confidence, AnalysisResult.RULES, false, "Rule-based analysis");
    }

    private static ProposedAction action(ActionKind kind, String target, String content, double confidence, String rationale) {
        return new ProposedAction(kind, target, content, confidence, rationale, AnalysisResult.RULES, false);
    }

    private static String firstSentence(String body) {
        for (String paragraph : body.split("\\n\\s*\\n")) {
            String text = paragraph.strip();
            if (text.isEmpty() || text.startsWith("#") || text.startsWith(">") || text.startsWith("-")) {
                continue;
            }
            String flat = text.replaceAll("\\s+", " ");
            int end = flat.indexOf(". ");
            String sentence = end > 0 ? flat.substring(0, end + 1) : flat;
            return sentence.length() <= MAX_SUMMARY_CHARS ? sentence : sentence.substring(0, MAX_SUMMARY_CHARS) + "...";
        }
        return null;
    }
}
