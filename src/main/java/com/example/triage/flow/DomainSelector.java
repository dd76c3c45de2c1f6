package com.example.triage.flow;

import com.example.triage.model.Domain;
import com.example.triage.model.ResponseSet;
import com.example.triage.registry.DomainRegistry;
import com.example.triage.registry.RuleEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Escolhe o próximo domínio a partir da tabela de ativação: o de maior
 * prioridade entre os ativados e ainda não visitados, com empate resolvido
 * pela ordem de declaração. Domínios terminais e continuações não entram.
 */
public class DomainSelector {

    private final DomainRegistry registry;

    public DomainSelector(DomainRegistry registry) {
        this.registry = registry;
    }

    public Optional<Domain> select(ResponseSet responses, Set<String> visited) {
        Domain best = null;
        for (Domain domain : registry.getDomains()) {
            if (domain.isTerminal() || domain.isContinuation() || visited.contains(domain.getId())) {
                continue;
            }
            if (!RuleEvaluator.evaluate(domain.getTrigger(), responses)) {
                continue;
            }
            if (best == null || domain.getPriority() > best.getPriority()) {
                best = domain;
            }
        }
        return Optional.ofNullable(best);
    }

    public Optional<Domain> continuationFor(Domain parent, ResponseSet responses, Set<String> visited) {
        return registry.findContinuationOf(parent.getId())
                .filter(domain -> !visited.contains(domain.getId()))
                .filter(domain -> RuleEvaluator.evaluate(domain.getTrigger(), responses));
    }

    /**
     * Domínios que ainda devem ser percorridos com as respostas atuais,
     * incluindo o terminal. Usado para estimar progresso e tempo restante.
     */
    public List<Domain> pending(ResponseSet responses, Set<String> visited) {
        List<Domain> pending = new ArrayList<>();
        for (Domain domain : registry.getDomains()) {
            if (visited.contains(domain.getId())) {
                continue;
            }
            if (domain.isTerminal() || RuleEvaluator.evaluate(domain.getTrigger(), responses)) {
                pending.add(domain);
            }
        }
        return pending;
    }
}
