package app.scapin.memory.content;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML block delimited by {@code ---} lines at the very top of a markdown note.
 *
 * @param block  the raw block including both delimiters and the trailing newline, empty when absent
 * @param fields parsed top-level keys; empty when the block is absent or malformed
 * @param body   everything after the block
 */
public record FrontMatter(String block, Map<String, Object> fields, String body) {

    private static final String DELIMITER = "---";

    public static FrontMatter parse(String content) {
        String text = content == null ? "" : content;
        if (!text.startsWith(DELIMITER + "\n") && !text.startsWith(DELIMITER + "\r\n")) {
            return new FrontMatter("", Map.of(), text);
        }
        int firstBreak = text.indexOf('\n');
        int close = text.indexOf("\n" + DELIMITER, firstBreak);
        if (close < 0) {
            return new FrontMatter("", Map.of(), text);
        }
        int afterClose = close + 1 + DELIMITER.length();
        int lineEnd = text.indexOf('\n', afterClose);
        int blockEnd = lineEnd < 0 ? text.length() : lineEnd + 1;

        String yamlText = text.substring(firstBreak + 1, close);
        return new FrontMatter(text.substring(0, blockEnd), load(yamlText), text.substring(blockEnd));
    }

    public String string(String key) {
        Object value = fields.get(key);
        return value == null ? null : value.toString();
    }

    private static Map<String, Object> load(String yamlText) {
        try {
            Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlText);
            if (!(loaded instanceof Map<?, ?> map)) {
                return Map.of();
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (k != null) {
                    fields.put(k.toString(), v);
                }
            });
            return fields;
        } catch (YAMLException ex) {
            return Map.of();
        }
    }
}
