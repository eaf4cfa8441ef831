package app.scapin.memory.analysis;

import app.scapin.memory.content.FrontMatter;
import app.scapin.memory.content.Note;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metrics of a note computed once before analysis.
 */
public record AnalysisContext(
        Note note,
        String body,
        int wordCount,
        boolean hasSummary,
        List<Section> sections,
        int linkCount,
        int questionCount
) {
    private static final Pattern SUMMARY = Pattern.compile(
            "^(##?\\s*(Résumé|Resume|Summary|TL;DR|En bref)|>\\s*\\*\\*(Résumé|Summary))",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern WIKILINK = Pattern.compile("\\[\\[([^\\]|]+)(?:\\|[^\\]]+)?\\]\\]");
    private static final Pattern QUESTION = Pattern.compile("\\?(\\s|$)");

    public record Section(String heading, int wordCount) {
    }

    public AnalysisContext {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public static AnalysisContext from(Note note) {
        String body = FrontMatter.parse(note.content()).body();
        return new AnalysisContext(
                note,
                body,
                countWords(body),
                SUMMARY.matcher(body).find(),
                sections(body),
                links(body).size(),
                countMatches(QUESTION, body)
        );
    }

    public int sectionCount() {
        return sections.size();
    }

    public boolean hasSection(String heading) {
        return sections.stream().anyMatch(s -> s.heading().equalsIgnoreCase(heading));
    }

    static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static Set<String> links(String text) {
        Set<String> links = new LinkedHashSet<>();
        Matcher matcher = WIKILINK.matcher(text);
        while (matcher.find()) {
            links.add(matcher.group(1).trim());
        }
        return links;
    }

    private static List<Section> sections(String body) {
        List<Section> sections = new ArrayList<>();
        String heading = null;
        StringBuilder text = new StringBuilder();
        for (String line : body.split("\n", -1)) {
            if (line.startsWith("## ")) {
                if (heading != null) {
                    sections.add(new Section(heading, countWords(text.toString())));
                }
                heading = line.substring(3).trim();
                text.setLength(0);
            } else if (heading != null) {
                text.append(line).append('\n');
            }
        }
        if (heading != null) {
            sections.add(new Section(heading, countWords(text.toString())));
        }
        return sections;
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
