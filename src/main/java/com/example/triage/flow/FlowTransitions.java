package com.example.triage.flow;

import com.example.triage.exception.FlowDefectException;
import com.example.triage.exception.InvalidTransitionException;
import com.example.triage.model.AssessmentResults;
import com.example.triage.model.Domain;
import com.example.triage.model.FlowResult;
import com.example.triage.model.FlowResultType;
import com.example.triage.model.FlowStage;
import com.example.triage.model.Question;
import com.example.triage.model.ResponseSet;
import com.example.triage.registry.DomainRegistry;
import com.example.triage.registry.RuleEvaluator;
import com.example.triage.scoring.ResultAssembler;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Função de transição do fluxo: (estado, entrada) -> (novo estado, resultado).
 * Nunca altera o estado recebido; em caso de erro nada é devolvido e o
 * chamador continua com o estado anterior.
 */
public class FlowTransitions {

    private static final Logger log = LoggerFactory.getLogger(FlowTransitions.class);

    static final String COMPLETE_LABEL = "Concluído";

    private final DomainRegistry registry;
    private final DomainSelector selector;
    private final ResponseValidator validator;
    private final ResultAssembler assembler;
    private final Clock clock;

    public FlowTransitions(DomainRegistry registry, DomainSelector selector, ResponseValidator validator,
                           ResultAssembler assembler, Clock clock) {
        this.registry = registry;
        this.selector = selector;
        this.validator = validator;
        this.assembler = assembler;
        this.clock = clock;
    }

    @Value
    public static class Transition {
        FlowState state;
        FlowResult result;
    }

    public Transition apply(FlowState current, String questionId, Object value) {
        if (current.getStage().isFinished() || questionId == null) {
            throw new InvalidTransitionException(current.getStage(), expectedInput(current), questionId);
        }
        boolean pseudoInput = FlowController.INIT.equals(questionId) || FlowController.CONTINUE.equals(questionId);
        if (pseudoInput && !Boolean.TRUE.equals(value)) {
            throw new InvalidTransitionException(current.getStage(), expectedInput(current), questionId + "=" + value);
        }
        FlowState next = current.copy();
        FlowResult result;
        if (FlowController.INIT.equals(questionId)) {
            result = start(next, questionId);
        } else if (FlowController.CONTINUE.equals(questionId)) {
            result = enterDomain(next, questionId);
        } else {
            result = answer(next, questionId, value);
        }
        return new Transition(next, result);
    }

    private FlowResult start(FlowState state, String input) {
        requireStage(state, input, FlowStage.NOT_STARTED);
        state.setStage(FlowStage.TRIAGE);
        log.debug("Triage started");
        return advance(state, registry.getTriage(), -1);
    }

    private FlowResult enterDomain(FlowState state, String input) {
        requireStage(state, input, FlowStage.AWAITING_CONTINUE);
        Domain domain = registry.requireDomain(state.getCurrentDomainId());
        state.setStage(FlowStage.DOMAIN_ACTIVE);
        log.info("Entering domain {}", domain.getId());
        return advance(state, domain, -1);
    }

    private FlowResult answer(FlowState state, String questionId, Object value) {
        FlowStage stage = state.getStage();
        boolean answering = stage == FlowStage.TRIAGE || stage == FlowStage.DOMAIN_ACTIVE;
        if (!answering || !questionId.equals(state.getCurrentQuestionId())) {
            throw new InvalidTransitionException(stage, expectedInput(state), questionId);
        }

        Domain group = currentGroup(state);
        int index = group.indexOf(questionId);
        if (index < 0) {
            throw new FlowDefectException("Pergunta " + questionId + " não pertence a " + group.getId());
        }
        Question question = group.getQuestions().get(index);

        Object normalized = ResponseSet.normalize(value);
        validator.validate(question, normalized);
        if (normalized != null) {
            state.getResponses().record(questionId, normalized, clock.instant());
        }
        log.debug("Answer recorded for {} ({})", questionId, group.getId());
        return advance(state, group, index);
    }

    private FlowResult advance(FlowState state, Domain group, int fromIndex) {
        ResponseSet responses = state.getResponses().view();
        List<Question> questions = group.getQuestions();
        for (int i = fromIndex + 1; i < questions.size(); i++) {
            Question candidate = questions.get(i);
            if (RuleEvaluator.isSurfaced(candidate, responses)) {
                state.setCurrentQuestionId(candidate.getId());
                return questionResult(state, candidate, responses);
            }
        }
        state.setCurrentQuestionId(null);
        return exhausted(state, group, responses);
    }

    private FlowResult exhausted(FlowState state, Domain group, ResponseSet responses) {
        if (state.getStage() == FlowStage.TRIAGE) {
            log.debug("Triage complete with {} answers", responses.size());
            return nextDomain(state, responses);
        }

        state.getVisitedDomains().add(group.getId());
        log.info("Domain {} complete", group.getId());
        if (group.isTerminal()) {
            return complete(state, responses);
        }
        Optional<Domain> continuation = selector.continuationFor(group, responses, state.getVisitedDomains());
        if (continuation.isPresent()) {
            return announce(state, continuation.get(), responses);
        }
        return nextDomain(state, responses);
    }

    private FlowResult nextDomain(FlowState state, ResponseSet responses) {
        Optional<Domain> selected = selector.select(responses, state.getVisitedDomains());
        if (selected.isPresent()) {
            return announce(state, selected.get(), responses);
        }
        Domain terminal = registry.getTerminal();
        if (!state.getVisitedDomains().contains(terminal.getId())) {
            return announce(state, terminal, responses);
        }
        return complete(state, responses);
    }

    private FlowResult announce(FlowState state, Domain domain, ResponseSet responses) {
        state.setStage(FlowStage.AWAITING_CONTINUE);
        state.setCurrentDomainId(domain.getId());
        state.setCurrentQuestionId(null);
        log.info("Domain transition to {}", domain.getId());
        return FlowResult.builder()
                .type(FlowResultType.DOMAIN_TRANSITION)
                .domain(domain.toDescriptor())
                .message(String.format("Agora vamos falar sobre %s. %s",
                        domain.getName().toLowerCase(Locale.ROOT), domain.getDescription()))
                .progress(progress(state, responses))
                .currentDomain(domain.getName())
                .estimatedTimeRemaining(timeRemaining(state, responses))
                .build();
    }

    private FlowResult questionResult(FlowState state, Question question, ResponseSet responses) {
        if (!RuleEvaluator.isSurfaced(question, responses)) {
            throw new FlowDefectException("Pergunta " + question.getId() + " exibida sem atender à condição");
        }
        return FlowResult.builder()
                .type(FlowResultType.QUESTION)
                .question(question)
                .progress(progress(state, responses))
                .currentDomain(currentGroup(state).getName())
                .estimatedTimeRemaining(timeRemaining(state, responses))
                .build();
    }

    private FlowResult complete(FlowState state, ResponseSet responses) {
        state.setStage(FlowStage.COMPLETE);
        state.setCurrentDomainId(null);
        state.setCurrentQuestionId(null);
        AssessmentResults results = assembler.assemble(responses,
                new ArrayList<>(state.getVisitedDomains()), false, clock.instant());
        log.info("Assessment complete: domains={} riskBand={} fraud={}",
                state.getVisitedDomains(), results.getRiskAssessment().getRiskBand(),
                results.getFraudIndicators().getRecommendation());
        return FlowResult.builder()
                .type(FlowResultType.COMPLETE)
                .results(results)
                .progress(100)
                .currentDomain(COMPLETE_LABEL)
                .estimatedTimeRemaining(0)
                .build();
    }

    Domain currentGroup(FlowState state) {
        if (state.getStage() == FlowStage.TRIAGE || state.getStage() == FlowStage.NOT_STARTED) {
            return registry.getTriage();
        }
        return registry.requireDomain(state.getCurrentDomainId());
    }

    /**
     * Percentual de etapas concluídas, considerando a triagem e os domínios
     * que as respostas atuais ativam.
     */
    int progress(FlowState state, ResponseSet responses) {
        if (state.getStage() == FlowStage.COMPLETE) return 100;
        boolean triageDone = state.getStage() != FlowStage.NOT_STARTED && state.getStage() != FlowStage.TRIAGE;
        int done = state.getVisitedDomains().size() + (triageDone ? 1 : 0);
        int total = done + selector.pending(responses, state.getVisitedDomains()).size() + (triageDone ? 0 : 1);
        return Math.round(done * 100f / total);
    }

    int timeRemaining(FlowState state, ResponseSet responses) {
        int minutes = 0;
        for (Domain domain : selector.pending(responses, state.getVisitedDomains())) {
            minutes += domain.getEstimatedMinutes();
        }
        boolean triageDone = state.getStage() != FlowStage.NOT_STARTED && state.getStage() != FlowStage.TRIAGE;
        return triageDone ? minutes : minutes + registry.getTriage().getEstimatedMinutes();
    }

    private static void requireStage(FlowState state, String input, FlowStage required) {
        if (state.getStage() != required) {
            throw new InvalidTransitionException(state.getStage(), expectedInput(state), input);
        }
    }

    static String expectedInput(FlowState state) {
        switch (state.getStage()) {
            case NOT_STARTED:
                return FlowController.INIT;
            case AWAITING_CONTINUE:
                return FlowController.CONTINUE;
            case TRIAGE:
            case DOMAIN_ACTIVE:
                return state.getCurrentQuestionId();
            default:
                return "-";
        }
    }
}
