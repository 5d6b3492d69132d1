package uk.gegc.assessment.features.attempt.infra.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.attempt.domain.model.AttemptAnswerEntry;
import uk.gegc.assessment.features.attempt.domain.model.AttemptVersion;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes the attempt version document. Accepts documents that still carry the
 * single-answer {@code answerId} field and only ever writes {@code answerIds}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttemptVersionCodec {

    private final ObjectMapper objectMapper;

    /**
     * Parses a stored document. A blank value yields an empty document; anything that is not a
     * JSON object is rejected rather than silently replaced.
     */
    public AttemptVersion read(String json) {
        if (json == null || json.isBlank()) {
            return new AttemptVersion();
        }
        AttemptVersion version;
        try {
            version = objectMapper.readValue(json, AttemptVersion.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored attempt version document is malformed", e);
        }
        if (version == null) {
            throw new IllegalStateException("Stored attempt version document is malformed");
        }
        if (version.getAnswers() == null) {
            version.setAnswers(new ArrayList<>());
        }
        version.getAnswers().removeIf(Objects::isNull);
        version.getAnswers().forEach(AttemptAnswerEntry::normalise);
        return version;
    }

    /**
     * Lenient variant for read-only views: a malformed document is logged and treated as absent.
     */
    public Optional<AttemptVersion> tryRead(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(json));
        } catch (IllegalStateException ex) {
            log.warn("Ignoring malformed attempt version document: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public String write(AttemptVersion version) {
        try {
            return objectMapper.writeValueAsString(version);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise attempt version document", e);
        }
    }
}
