package com.example.triage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    /**
     * Recurso do classpath com a definição do questionário.
     */
    private String questionnaireResource = "questionnaire.json";

    /**
     * Tempo de vida do estado da sessão no Redis.
     */
    private Duration sessionTtl = Duration.ofHours(24);

    private String keyPrefix = "triage:session:";

    public String sessionKey(String sessionId) {
        return keyPrefix + sessionId;
    }

    public String resultsKey(String sessionId) {
        return keyPrefix + sessionId + ":results";
    }
}
