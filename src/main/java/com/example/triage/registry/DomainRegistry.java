package com.example.triage.registry;

import com.example.triage.exception.FlowDefectException;
import com.example.triage.model.ConditionalRule;
import com.example.triage.model.Domain;
import com.example.triage.model.Question;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tabela declarativa de domínios e perguntas. Imutável depois de construída e
 * compartilhada entre todas as sessões.
 */
public class DomainRegistry {

    private static final Logger log = LoggerFactory.getLogger(DomainRegistry.class);

    public static final String DEFAULT_RESOURCE = "questionnaire.json";

    private final String questionnaireId;
    private final String version;
    private final Domain triage;
    private final List<Domain> domains;
    private final Map<String, Domain> domainsById = new LinkedHashMap<>();
    private final Map<String, Question> questionsById = new LinkedHashMap<>();
    private final Map<String, String> domainIdByQuestion = new LinkedHashMap<>();
    private final Domain terminal;

    public DomainRegistry(QuestionnaireDefinition definition) {
        if (definition.getTriage() == null) {
            throw new FlowDefectException("Questionário sem etapa de triagem");
        }
        this.questionnaireId = definition.getQuestionnaireId();
        this.version = definition.getVersion();
        this.triage = definition.getTriage();
        this.domains = definition.getDomains() == null ? List.of() : List.copyOf(definition.getDomains());

        indexQuestions(triage);
        Domain terminalDomain = null;
        for (Domain domain : domains) {
            if (domainsById.put(domain.getId(), domain) != null) {
                throw new FlowDefectException("Domínio duplicado: " + domain.getId());
            }
            indexQuestions(domain);
            if (domain.isTerminal()) {
                if (terminalDomain != null) {
                    throw new FlowDefectException("Mais de um domínio terminal: "
                            + terminalDomain.getId() + ", " + domain.getId());
                }
                terminalDomain = domain;
            }
        }
        if (terminalDomain == null) {
            throw new FlowDefectException("Questionário sem domínio terminal");
        }
        this.terminal = terminalDomain;
        validateReferences();
    }

    public static DomainRegistry fromClasspath(String resource, ObjectMapper mapper) {
        try (InputStream in = DomainRegistry.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new FlowDefectException("Recurso não encontrado no classpath: " + resource);
            }
            QuestionnaireDefinition definition = mapper.readValue(in, QuestionnaireDefinition.class);
            DomainRegistry registry = new DomainRegistry(definition);
            log.info("Loaded questionnaire {} v{}: {} domains, {} questions",
                    registry.getQuestionnaireId(), registry.getVersion(),
                    registry.getDomains().size(), registry.totalQuestionCount());
            return registry;
        } catch (IOException e) {
            throw new FlowDefectException("Erro ao carregar " + resource, e);
        }
    }

    public static DomainRegistry loadDefault() {
        return fromClasspath(DEFAULT_RESOURCE, new ObjectMapper());
    }

    private void indexQuestions(Domain domain) {
        for (Question question : domain.getQuestions()) {
            if (questionsById.put(question.getId(), question) != null) {
                throw new FlowDefectException("Pergunta duplicada: " + question.getId());
            }
            domainIdByQuestion.put(question.getId(), domain.getId());
        }
    }

    private void validateReferences() {
        // condições só podem apontar para perguntas anteriores no fluxo
        Set<String> seen = new HashSet<>();
        checkConditions(triage, seen);
        for (Domain domain : domains) {
            if (!domain.isTerminal() && domain.getTrigger() == null) {
                throw new FlowDefectException("Domínio sem regra de ativação: " + domain.getId());
            }
            if (domain.getTrigger() != null && !questionsById.containsKey(domain.getTrigger().getQuestionId())) {
                throw new FlowDefectException("Regra de ativação de " + domain.getId()
                        + " referencia pergunta inexistente: " + domain.getTrigger().getQuestionId());
            }
            if (domain.isContinuation() && !domainsById.containsKey(domain.getContinuationOf())) {
                throw new FlowDefectException("Domínio " + domain.getId()
                        + " continua domínio inexistente: " + domain.getContinuationOf());
            }
            checkConditions(domain, seen);
        }
    }

    private void checkConditions(Domain domain, Set<String> seen) {
        for (Question question : domain.getQuestions()) {
            ConditionalRule condition = question.getConditionalOn();
            if (condition != null && !seen.contains(condition.getQuestionId())) {
                throw new FlowDefectException("Pergunta " + question.getId()
                        + " depende de pergunta desconhecida ou posterior: " + condition.getQuestionId());
            }
            seen.add(question.getId());
        }
    }

    public String getQuestionnaireId() {
        return questionnaireId;
    }

    public String getVersion() {
        return version;
    }

    public Domain getTriage() {
        return triage;
    }

    /**
     * Domínios na ordem de declaração, que também é o critério de desempate.
     */
    public List<Domain> getDomains() {
        return domains;
    }

    public Domain getTerminal() {
        return terminal;
    }

    public Optional<Domain> findDomain(String domainId) {
        return Optional.ofNullable(domainsById.get(domainId));
    }

    public Domain requireDomain(String domainId) {
        Domain domain = domainsById.get(domainId);
        if (domain == null) {
            throw new FlowDefectException("Domínio desconhecido: " + domainId);
        }
        return domain;
    }

    public Optional<Domain> findContinuationOf(String parentId) {
        return domains.stream()
                .filter(d -> parentId.equals(d.getContinuationOf()))
                .findFirst();
    }

    public Optional<Question> findQuestion(String questionId) {
        return Optional.ofNullable(questionsById.get(questionId));
    }

    /**
     * Id do domínio (ou da triagem) que declara a pergunta.
     */
    public Optional<String> findOwnerOf(String questionId) {
        return Optional.ofNullable(domainIdByQuestion.get(questionId));
    }

    public int totalQuestionCount() {
        return questionsById.size();
    }
}
