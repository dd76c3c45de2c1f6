package com.example.triage.flow;

import com.example.triage.exception.InvalidTransitionException;
import com.example.triage.exception.SnapshotRestoreException;
import com.example.triage.exception.TriageException;
import com.example.triage.model.AssessmentResults;
import com.example.triage.model.Domain;
import com.example.triage.model.DomainDescriptor;
import com.example.triage.model.FlowResult;
import com.example.triage.model.FlowSnapshot;
import com.example.triage.model.FlowStage;
import com.example.triage.model.Question;
import com.example.triage.model.Response;
import com.example.triage.model.ResponseSet;
import com.example.triage.registry.DomainRegistry;
import com.example.triage.registry.RuleEvaluator;
import com.example.triage.scoring.ResultAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Máquina de estados de uma sessão de triagem. Recebe uma resposta por vez,
 * decide o próximo passo e só adota o novo estado quando a transição é aceita.
 * Não é thread-safe: chamadas da mesma sessão devem ser serializadas.
 */
public class FlowController {

    private static final Logger log = LoggerFactory.getLogger(FlowController.class);

    public static final String INIT = "_init";
    public static final String CONTINUE = "_continue";

    private final DomainRegistry registry;
    private final FlowTransitions transitions;
    private final ResultAssembler assembler;
    private final Clock clock;

    private FlowState state = new FlowState();

    public FlowController(DomainRegistry registry, ResultAssembler assembler, Clock clock) {
        this.registry = registry;
        this.assembler = assembler;
        this.clock = clock;
        this.transitions = new FlowTransitions(registry, new DomainSelector(registry),
                new ResponseValidator(), assembler, clock);
    }

    /**
     * Processa a entrada do usuário: {@code _init}, {@code _continue} ou a
     * resposta para a pergunta atual. Entradas rejeitadas não alteram nada.
     */
    public FlowResult processResponse(String questionId, Object value) {
        try {
            FlowTransitions.Transition transition = transitions.apply(state, questionId, value);
            state = transition.getState();
            return transition.getResult();
        } catch (TriageException e) {
            log.debug("Input {} rejected in stage {}: {}", questionId, state.getStage(), e.getClass().getSimpleName());
            throw e;
        }
    }

    public Map<String, Object> getResponses() {
        return state.getResponses().view().asMap();
    }

    public Optional<DomainDescriptor> getCurrentDomain() {
        switch (state.getStage()) {
            case TRIAGE:
                return Optional.of(registry.getTriage().toDescriptor());
            case AWAITING_CONTINUE:
            case DOMAIN_ACTIVE:
                return registry.findDomain(state.getCurrentDomainId()).map(Domain::toDescriptor);
            default:
                return Optional.empty();
        }
    }

    public Optional<Question> getCurrentQuestion() {
        if (state.getCurrentQuestionId() == null) {
            return Optional.empty();
        }
        return registry.findQuestion(state.getCurrentQuestionId());
    }

    public FlowStage getStage() {
        return state.getStage();
    }

    public List<String> getCompletedDomains() {
        return new ArrayList<>(state.getVisitedDomains());
    }

    public FlowSnapshot getState() {
        return state.toSnapshot();
    }

    public void restoreState(FlowSnapshot snapshot) {
        validate(snapshot);
        state = FlowState.fromSnapshot(snapshot);
        log.debug("State restored at stage {} ({} answers)", state.getStage(), state.getResponses().size());
    }

    /**
     * Encerra a sessão antes do fim e devolve um resultado parcial com o que
     * já foi respondido.
     */
    public AssessmentResults abandon() {
        if (state.getStage().isFinished()) {
            throw new InvalidTransitionException(state.getStage(), "-", "abandon");
        }
        AssessmentResults results = computeResults();
        FlowState abandoned = state.copy();
        abandoned.setStage(FlowStage.ABANDONED);
        abandoned.setCurrentQuestionId(null);
        state = abandoned;
        log.info("Assessment abandoned after {} answers, domains={}",
                state.getResponses().size(), state.getVisitedDomains());
        return results;
    }

    /**
     * Calcula os resultados com as respostas atuais, mesmo que a sessão não
     * esteja concluída.
     */
    public AssessmentResults computeResults() {
        return assembler.assemble(state.getResponses().view(), getCompletedDomains(),
                state.getStage() != FlowStage.COMPLETE, clock.instant());
    }

    private void validate(FlowSnapshot snapshot) {
        if (snapshot == null || snapshot.getStage() == null) {
            throw new SnapshotRestoreException("Snapshot sem estágio");
        }
        List<String> visited = snapshot.getVisitedDomains() == null ? List.of() : snapshot.getVisitedDomains();
        for (String domainId : visited) {
            if (registry.findDomain(domainId).isEmpty()) {
                throw new SnapshotRestoreException("Domínio visitado desconhecido: " + domainId);
            }
        }
        if (snapshot.getResponses() != null) {
            for (Response response : snapshot.getResponses()) {
                if (response.getQuestionId() == null || registry.findQuestion(response.getQuestionId()).isEmpty()) {
                    throw new SnapshotRestoreException("Resposta para pergunta desconhecida: " + response.getQuestionId());
                }
            }
        }

        String domainId = snapshot.getCurrentDomainId();
        String questionId = snapshot.getCurrentQuestionId();
        switch (snapshot.getStage()) {
            case NOT_STARTED:
                if (questionId != null || domainId != null) {
                    throw new SnapshotRestoreException("Sessão não iniciada não pode ter cursor");
                }
                break;
            case TRIAGE:
                requireSurfaced(registry.getTriage(), questionId, snapshot);
                break;
            case AWAITING_CONTINUE:
                requireOpenDomain(domainId, visited);
                if (questionId != null) {
                    throw new SnapshotRestoreException("Aguardando início de domínio com pergunta ativa: " + questionId);
                }
                break;
            case DOMAIN_ACTIVE:
                requireSurfaced(requireOpenDomain(domainId, visited), questionId, snapshot);
                break;
            default:
                break;
        }
    }

    private Domain requireOpenDomain(String domainId, List<String> visited) {
        Domain domain = domainId == null ? null : registry.findDomain(domainId).orElse(null);
        if (domain == null) {
            throw new SnapshotRestoreException("Domínio atual desconhecido: " + domainId);
        }
        if (visited.contains(domainId)) {
            throw new SnapshotRestoreException("Domínio atual já foi visitado: " + domainId);
        }
        return domain;
    }

    private void requireSurfaced(Domain group, String questionId, FlowSnapshot snapshot) {
        Optional<Question> question = questionId == null ? Optional.empty() : group.findQuestion(questionId);
        if (question.isEmpty()) {
            throw new SnapshotRestoreException("Pergunta atual " + questionId + " não pertence a " + group.getId());
        }
        ResponseSet responses = ResponseStore.fromList(snapshot.getResponses()).view();
        if (!RuleEvaluator.isSurfaced(question.get(), responses)) {
            throw new SnapshotRestoreException("Pergunta atual " + questionId + " não atende à sua condição");
        }
    }
}
