package app.scapin.memory.review.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NoteTypeTest {

    @Test
    void reviewConfigMatchesTypeTable() {
        assertThat(NoteType.PERSON.reviewConfig().baseIntervalHours()).isEqualTo(2.0);
        assertThat(NoteType.PERSON.reviewConfig().maxIntervalDays()).isEqualTo(30);
        assertThat(NoteType.PROJECT.reviewConfig().initialEasinessFactor()).isEqualTo(2.0);
        assertThat(NoteType.EVENT.reviewConfig().maxIntervalHours()).isEqualTo(180 * 24.0);
        assertThat(NoteType.MEMORY.isReviewable()).isFalse();
        for (NoteType type : NoteType.values()) {
            assertThat(type.reviewConfig().webSearchDefault()).isFalse();
        }
    }

    @Test
    void resolvesTypeFromFolderNames() {
        assertThat(NoteType.fromPath("Personnes/Alice Martin")).isEqualTo(NoteType.PERSON);
        assertThat(NoteType.fromPath("archive/Projects/Atlas")).isEqualTo(NoteType.PROJECT);
        assertThat(NoteType.fromPath("Réunions/2025-03-01")).isEqualTo(NoteType.MEETING);
        assertThat(NoteType.fromPath("inbox/idea")).isEqualTo(NoteType.OTHER);
        assertThat(NoteType.fromString("process")).isEqualTo(NoteType.PROCESS);
        assertThat(NoteType.fromString("souvenirs")).isEqualTo(NoteType.MEMORY);
        assertThat(NoteType.fromString(null)).isEqualTo(NoteType.OTHER);
    }

    @Test
    void importanceParsesEnglishAndFrenchValues() {
        assertThat(ImportanceLevel.parse("critique")).isEqualTo(ImportanceLevel.CRITICAL);
        assertThat(ImportanceLevel.parse("HIGH")).isEqualTo(ImportanceLevel.HIGH);
        assertThat(ImportanceLevel.parse("basse")).isEqualTo(ImportanceLevel.LOW);
        assertThat(ImportanceLevel.parse("archive").isSelectable()).isFalse();
        assertThat(ImportanceLevel.parse("whatever")).isEqualTo(ImportanceLevel.NORMAL);
        assertThat(ImportanceLevel.CRITICAL.rank()).isLessThan(ImportanceLevel.LOW.rank());
    }
}
