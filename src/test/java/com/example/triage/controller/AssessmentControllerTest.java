package com.example.triage.controller;

import com.example.triage.exception.FlowDefectException;
import com.example.triage.exception.InvalidTransitionException;
import com.example.triage.exception.ResponseRangeException;
import com.example.triage.exception.SessionNotFoundException;
import com.example.triage.flow.FlowFixtures;
import com.example.triage.model.AssessmentResults;
import com.example.triage.model.FlowResult;
import com.example.triage.model.FlowResultType;
import com.example.triage.model.FlowStage;
import com.example.triage.service.AssessmentSessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AssessmentController.class)
@DisplayName("AssessmentController")
class AssessmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AssessmentSessionService sessionService;

    @Test
    @DisplayName("Should return the next question")
    void shouldReturnNextQuestion() throws Exception {
        // Given
        FlowResult result = FlowResult.builder()
                .type(FlowResultType.QUESTION)
                .question(FlowFixtures.REGISTRY.findQuestion("age").orElseThrow())
                .progress(0)
                .currentDomain("Avaliação Inicial")
                .estimatedTimeRemaining(3)
                .build();
        when(sessionService.nextStep("s1", "_init", true)).thenReturn(result);

        // When / Then
        mockMvc.perform(post("/assessment/next_step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"questionId\":\"_init\",\"value\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("question"))
                .andExpect(jsonPath("$.question.id").value("age"))
                .andExpect(jsonPath("$.question.type").value("number"))
                .andExpect(jsonPath("$.estimatedTimeRemaining").value(3));
    }

    @Test
    @DisplayName("Should pass list answers through to the service")
    void shouldAcceptListAnswers() throws Exception {
        when(sessionService.nextStep(eq("s1"), eq("emergency_check"), any()))
                .thenReturn(FlowResult.builder().type(FlowResultType.QUESTION).build());

        mockMvc.perform(post("/assessment/next_step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"questionId\":\"emergency_check\",\"value\":[\"none\"]}"))
                .andExpect(status().isOk());

        verify(sessionService).nextStep("s1", "emergency_check", List.of("none"));
    }

    @Test
    @DisplayName("Should answer 409 for out-of-order input")
    void shouldMapInvalidTransition() throws Exception {
        when(sessionService.nextStep("s1", "pain_severity", 3))
                .thenThrow(new InvalidTransitionException(FlowStage.TRIAGE, "age", "pain_severity"));

        mockMvc.perform(post("/assessment/next_step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"questionId\":\"pain_severity\",\"value\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409))
                .andExpect(jsonPath("$.error").value("Invalid Transition"));
    }

    @Test
    @DisplayName("Should answer 400 for invalid answers")
    void shouldMapInvalidResponse() throws Exception {
        when(sessionService.nextStep("s1", "age", 121))
                .thenThrow(new ResponseRangeException("age", 0.0, 120.0));

        mockMvc.perform(post("/assessment/next_step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"s1\",\"questionId\":\"age\",\"value\":121}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Resposta para 'age' fora do intervalo permitido [0, 120]"));
    }

    @Test
    @DisplayName("Should answer 400 without calling the service when ids are missing")
    void shouldValidateRequest() throws Exception {
        mockMvc.perform(post("/assessment/next_step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"_init\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        mockMvc.perform(post("/assessment/next_step")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sessionService);
    }

    @Test
    @DisplayName("Should answer 404 for unknown sessions")
    void shouldMapSessionNotFound() throws Exception {
        when(sessionService.getResponses("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/assessment/missing/responses"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should answer 500 for questionnaire defects")
    void shouldMapFlowDefect() throws Exception {
        when(sessionService.getState("s1")).thenThrow(new FlowDefectException("Domínio desconhecido: x"));

        mockMvc.perform(get("/assessment/s1/state"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Flow Defect"));
    }

    @Test
    @DisplayName("Should return recorded responses")
    void shouldReturnResponses() throws Exception {
        when(sessionService.getResponses("s1")).thenReturn(Map.of("age", 30));

        mockMvc.perform(get("/assessment/s1/responses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.age").value(30));
    }

    @Test
    @DisplayName("Should return partial results when abandoning")
    void shouldAbandon() throws Exception {
        when(sessionService.abandon("s1")).thenReturn(AssessmentResults.builder()
                .responses(Map.of("age", 30))
                .completedDomains(List.of())
                .partial(true)
                .build());

        mockMvc.perform(delete("/assessment/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.partial").value(true))
                .andExpect(jsonPath("$.responses.age").value(30));
    }
}
