package uk.gegc.assessment.features.content.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.assessment.features.content.api.dto.AnswerContentRequest;
import uk.gegc.assessment.features.content.api.dto.QuestionContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestContentRequest;
import uk.gegc.assessment.features.content.api.dto.TestDto;
import uk.gegc.assessment.features.content.application.TestAuthoringService;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TestController.class)
@DisplayName("TestController")
class TestControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private TestAuthoringService authoringService;

    private TestContentRequest request() {
        return new TestContentRequest(null, "Capitals", 1, null, List.of(
                new QuestionContentRequest("France?", null, List.of(
                        new AnswerContentRequest("Paris", 1), new AnswerContentRequest("Rome", 0)))));
    }

    @Test
    @DisplayName("POST /api/v1/tests returns 201 with the stored test")
    void createTest_created() throws Exception {
        UUID id = UUID.randomUUID();
        when(authoringService.createTest(any())).thenReturn(
                new TestDto(id, null, "Capitals", 1, null, 1, List.of(), null, null));

        mockMvc.perform(post("/api/v1/tests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.maxPoints").value(1));
    }

    @Test
    @DisplayName("validation failure on a question reports its index")
    void createTest_invalidQuestion() throws Exception {
        when(authoringService.createTest(any())).thenThrow(
                new ValidationException("Question 2 must contain at least 2 answers", 2));

        mockMvc.perform(post("/api/v1/tests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.detail").value("Question 2 must contain at least 2 answers"))
                .andExpect(jsonPath("$.questionIndex").value(2));
    }

    @Test
    @DisplayName("malformed JSON body yields 400")
    void createTest_malformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/tests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));
    }

    @Test
    @DisplayName("GET unknown test yields 404 problem")
    void getTest_notFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(authoringService.getTest(id)).thenThrow(new ResourceNotFoundException("Test " + id + " not found"));

        mockMvc.perform(get("/api/v1/tests/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Test " + id + " not found"));
    }

    @Test
    @DisplayName("GET with a non-UUID id yields 400 type mismatch")
    void getTest_badId() throws Exception {
        mockMvc.perform(get("/api/v1/tests/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("id"));
    }

    @Test
    @DisplayName("DELETE returns 204")
    void deleteTest_noContent() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/tests/{id}", id))
                .andExpect(status().isNoContent());

        verify(authoringService).deleteTest(id);
    }
}
