package com.example.triage.config;

import com.example.triage.registry.DomainRegistry;
import com.example.triage.scoring.ClinicalScorer;
import com.example.triage.scoring.DomainRiskScorer;
import com.example.triage.scoring.FraudDetector;
import com.example.triage.scoring.GamificationScorer;
import com.example.triage.scoring.ResultAssembler;
import com.example.triage.scoring.RiskClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Componentes imutáveis do motor, compartilhados por todas as sessões.
 */
@Configuration
public class TriageEngineConfig {

    @Bean
    public DomainRegistry domainRegistry(TriageProperties properties, ObjectMapper objectMapper) {
        return DomainRegistry.fromClasspath(properties.getQuestionnaireResource(), objectMapper);
    }

    @Bean
    public ResultAssembler resultAssembler(DomainRegistry domainRegistry) {
        return new ResultAssembler(new ClinicalScorer(), new RiskClassifier(), new FraudDetector(),
                new GamificationScorer(domainRegistry), new DomainRiskScorer(domainRegistry));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
