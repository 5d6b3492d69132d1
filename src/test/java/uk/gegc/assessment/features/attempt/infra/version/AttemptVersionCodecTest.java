package uk.gegc.assessment.features.attempt.infra.version;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.assessment.features.attempt.domain.model.AttemptAnswerEntry;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AttemptVersionCodec Tests")
class AttemptVersionCodecTest {

    private final AttemptVersionCodec codec = new AttemptVersionCodec(new ObjectMapper());

    @Test
    @DisplayName("blank input reads as an empty document")
    void read_blank_emptyDocument() {
        assertThat(codec.read(null).getAnswers()).isEmpty();
        assertThat(codec.read("  ").getAttemptNo()).isNull();
    }

    @Test
    @DisplayName("legacy single answerId is folded into answerIds and never written back")
    void read_legacyAnswerId() {
        UUID questionId = UUID.randomUUID();
        UUID answerId = UUID.randomUUID();
        String json = """
                {"attemptNo":1,"answers":[{"questionId":"%s","answerId":"%s","earnedPoints":1}]}
                """.formatted(questionId, answerId);

        AttemptVersion version = codec.read(json);

        AttemptAnswerEntry entry = version.findEntry(questionId).orElseThrow();
        assertThat(entry.getAnswerIds()).containsExactly(answerId);
        assertThat(entry.getAnswerPoints()).containsExactly(0);
        assertThat(codec.write(version)).doesNotContain("\"answerId\"").contains("\"answerIds\"");
    }

    @Test
    @DisplayName("null entries are dropped and null lists become empty")
    void read_nullsNormalised() {
        UUID questionId = UUID.randomUUID();
        String json = """
                {"answers":[null,{"questionId":"%s","answerIds":null,"answerTexts":null,"answerPoints":null}]}
                """.formatted(questionId);

        AttemptVersion version = codec.read(json);

        assertThat(version.getAnswers()).hasSize(1);
        AttemptAnswerEntry entry = version.getAnswers().get(0);
        assertThat(entry.getAnswerIds()).isEmpty();
        assertThat(entry.getAnswerTexts()).isEmpty();
        assertThat(entry.getAnswerPoints()).isEmpty();
        assertThat(entry.hasAnswers()).isFalse();
    }

    @Test
    @DisplayName("misaligned points are zeroed and misaligned texts dropped")
    void read_misalignedLists() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        String json = """
                {"answers":[{"questionId":"%s","answerIds":["%s","%s"],"answerTexts":["only one"],"answerPoints":[3]}]}
                """.formatted(UUID.randomUUID(), a, b);

        AttemptAnswerEntry entry = codec.read(json).getAnswers().get(0);

        assertThat(entry.getAnswerIds()).containsExactly(a, b);
        assertThat(entry.getAnswerPoints()).containsExactly(0, 0);
        assertThat(entry.getAnswerTexts()).isEmpty();
    }

    @Test
    @DisplayName("malformed documents are rejected by read and ignored by tryRead")
    void malformedDocument() {
        assertThatThrownBy(() -> codec.read("{not json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("malformed");
        assertThatThrownBy(() -> codec.read("[1,2]")).isInstanceOf(IllegalStateException.class);
        assertThat(codec.tryRead("{not json")).isEmpty();
    }

    @Test
    @DisplayName("unknown fields are ignored and field order is stable on write")
    void write_stableOrder() {
        UUID questionId = UUID.randomUUID();
        AttemptVersion version = codec.read("""
                {"minPoint":2,"extra":"x","testTitle":"Capitals","attemptNo":3,"answers":[]}
                """);
        version.getAnswers().add(AttemptAnswerEntry.unanswered(1, questionId, "France?", 2));

        String json = codec.write(version);

        assertThat(json).startsWith("{\"attemptNo\":3,\"testTitle\":\"Capitals\",\"minPoint\":2,\"answers\":[");
        assertThat(json).doesNotContain("extra");
        assertThat(codec.write(codec.read(json))).isEqualTo(json);
        assertThat(codec.read(json).getAnswers()).extracting(AttemptAnswerEntry::getQuestionId)
                .containsExactly(questionId);
    }
}
