package com.example.triage.service;

import com.example.triage.config.TriageProperties;
import com.example.triage.exception.SessionNotFoundException;
import com.example.triage.exception.SnapshotRestoreException;
import com.example.triage.flow.FlowController;
import com.example.triage.model.AssessmentResults;
import com.example.triage.model.FlowResult;
import com.example.triage.model.FlowResultType;
import com.example.triage.model.FlowSnapshot;
import com.example.triage.registry.DomainRegistry;
import com.example.triage.scoring.ResultAssembler;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Mantém uma sessão de triagem por id no Redis. A cada chamada o snapshot é
 * restaurado em um novo {@link FlowController}, a entrada é aplicada e o novo
 * snapshot é salvo. Entradas rejeitadas não gravam nada.
 */
@Service
public class AssessmentSessionService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentSessionService.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper objectMapper;
    private final DomainRegistry registry;
    private final ResultAssembler assembler;
    private final Clock clock;
    private final TriageProperties properties;

    public AssessmentSessionService(RedisTemplate<String, Object> redisTemplate, ObjectMapper objectMapper,
                                    DomainRegistry registry, ResultAssembler assembler, Clock clock,
                                    TriageProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.registry = registry;
        this.assembler = assembler;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Aplica a entrada do usuário na sessão e devolve o próximo passo.
     * Uma sessão nova só pode começar com {@code _init}.
     */
    public FlowResult nextStep(String sessionId, String questionId, Object value) {
        FlowController controller = newController();
        Optional<FlowSnapshot> saved = getProgress(sessionId);
        if (saved.isPresent()) {
            controller.restoreState(saved.get());
        } else if (!FlowController.INIT.equals(questionId)) {
            throw new SessionNotFoundException(sessionId);
        } else {
            log.info("Starting session {}", sessionId);
        }

        FlowResult result = controller.processResponse(questionId, value);
        saveProgress(sessionId, controller.getState());

        if (result.getType() == FlowResultType.COMPLETE) {
            redisTemplate.opsForValue().set(properties.resultsKey(sessionId),
                    objectMapper.convertValue(result.getResults(), MAP_TYPE), properties.getSessionTtl());
            log.info("Session {} complete, results stored", sessionId);
        }
        return result;
    }

    /**
     * Retorna as respostas já registradas na sessão.
     */
    public Map<String, Object> getResponses(String sessionId) {
        return restore(sessionId).getResponses();
    }

    /**
     * Retorna o snapshot salvo da sessão.
     */
    public FlowSnapshot getState(String sessionId) {
        return getProgress(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Encerra a sessão antes do fim, devolve o resultado parcial e limpa o
     * estado salvo.
     */
    public AssessmentResults abandon(String sessionId) {
        FlowController controller = restore(sessionId);
        AssessmentResults results = controller.abandon();
        clearProgress(sessionId);
        log.info("Session {} abandoned", sessionId);
        return results;
    }

    /**
     * Salva o snapshot da sessão no Redis, com expiração.
     */
    public void saveProgress(String sessionId, FlowSnapshot snapshot) {
        Map<String, Object> payload = objectMapper.convertValue(snapshot, MAP_TYPE);
        redisTemplate.opsForValue().set(properties.sessionKey(sessionId), payload, properties.getSessionTtl());
        log.debug("Session {} saved at stage {}", sessionId, snapshot.getStage());
    }

    /**
     * Recupera o snapshot salvo para a sessão, se existir.
     */
    public Optional<FlowSnapshot> getProgress(String sessionId) {
        Object saved = redisTemplate.opsForValue().get(properties.sessionKey(sessionId));
        if (saved == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.convertValue(saved, FlowSnapshot.class));
        } catch (IllegalArgumentException e) {
            throw new SnapshotRestoreException("Estado salvo ilegível para a sessão " + sessionId);
        }
    }

    /**
     * Limpa o progresso salvo no cache para a sessão.
     */
    public void clearProgress(String sessionId) {
        redisTemplate.delete(properties.sessionKey(sessionId));
    }

    private FlowController restore(String sessionId) {
        FlowController controller = newController();
        controller.restoreState(getState(sessionId));
        return controller;
    }

    private FlowController newController() {
        return new FlowController(registry, assembler, clock);
    }
}
