package com.navcaddy.core.health;

import com.navcaddy.core.engine.SessionRegistry;
import com.navcaddy.core.llm.LanguageModelClient;
import com.navcaddy.core.llm.LlmProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    static final String UNSET_KEY = "not-set";

    private final LanguageModelClient languageModel;
    private final SessionRegistry sessionRegistry;
    private final LlmProperties llmProperties;
    private final String apiKey;

    public HealthCheckService(
            @Autowired(required = false) LanguageModelClient languageModel,
            @Autowired(required = false) SessionRegistry sessionRegistry,
            LlmProperties llmProperties,
            @Value("${spring.ai.openai.api-key:" + UNSET_KEY + "}") String apiKey) {
        this.languageModel = languageModel;
        this.sessionRegistry = sessionRegistry;
        this.llmProperties = llmProperties;
        this.apiKey = apiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkLanguageModel());
        results.add(checkSessions());
        return results;
    }

    private HealthStatus checkLanguageModel() {
        if (languageModel == null) {
            return new HealthStatus("languageModel", HealthStatus.Status.DOWN,
                    "No language model client configured", Map.of());
        }
        Map<String, String> metadata = Map.of(
                "model", llmProperties.hasModel() ? llmProperties.getModel() : "(provider default)",
                "timeout", llmProperties.getTimeout().toString());
        if (apiKey == null || apiKey.isBlank() || UNSET_KEY.equals(apiKey)) {
            return new HealthStatus("languageModel", HealthStatus.Status.DEGRADED,
                    "API key not set; classification will fail until OPENAI_API_KEY is provided", metadata);
        }
        return new HealthStatus("languageModel", HealthStatus.Status.UP,
                "Language model client available", metadata);
    }

    private HealthStatus checkSessions() {
        if (sessionRegistry == null) {
            return new HealthStatus("sessions", HealthStatus.Status.DOWN,
                    "Session registry not available", Map.of());
        }
        return new HealthStatus("sessions", HealthStatus.Status.UP,
                sessionRegistry.activeCount() + " active session(s)",
                Map.of("active", String.valueOf(sessionRegistry.activeCount())));
    }
}
