package com.example.triage.controller;

import com.example.triage.model.AssessmentResults;
import com.example.triage.model.FlowResult;
import com.example.triage.model.FlowSnapshot;
import com.example.triage.model.NextStepRequest;
import com.example.triage.service.AssessmentSessionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/assessment")
public class AssessmentController {

    private static final Logger log = LoggerFactory.getLogger(AssessmentController.class);

    @Autowired
    private AssessmentSessionService sessionService;

    /**
     * Endpoint principal: recebe uma resposta (ou _init / _continue), avança o
     * fluxo da sessão e devolve a próxima pergunta, a transição de domínio ou
     * o resultado final.
     */
    @PostMapping("/next_step")
    public FlowResult nextStep(@Valid @RequestBody NextStepRequest request) {
        log.debug("next_step session={} question={}", request.getSessionId(), request.getQuestionId());
        return sessionService.nextStep(request.getSessionId(), request.getQuestionId(), request.getValue());
    }

    @GetMapping("/{sessionId}/responses")
    public Map<String, Object> responses(@PathVariable String sessionId) {
        return sessionService.getResponses(sessionId);
    }

    @GetMapping("/{sessionId}/state")
    public FlowSnapshot state(@PathVariable String sessionId) {
        return sessionService.getState(sessionId);
    }

    /**
     * Abandona a sessão e devolve o resultado parcial.
     */
    @DeleteMapping("/{sessionId}")
    public AssessmentResults abandon(@PathVariable String sessionId) {
        return sessionService.abandon(sessionId);
    }
}
