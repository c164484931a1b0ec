package com.navcaddy.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "navcaddy.llm")
public class LlmProperties {

    private String model = "";
    private Duration timeout = Duration.ofSeconds(10);

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
