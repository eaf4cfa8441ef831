package app.scapin.memory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.memory.notes")
public record NotesProps(
        @DefaultValue("notes") String directory
) {
}
