package com.navcaddy.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link LanguageModelClient} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Sends the persona/system prompt and the context-plus-utterance user message, and returns the
 * reply text untouched. Parsing and validation are left to the classifier.
 */
@Service
public class ChatClientLanguageModel implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientLanguageModel.class);

    private final ChatClient chatClient;
    private final LlmProperties properties;

    public ChatClientLanguageModel(ChatClient.Builder builder, LlmProperties properties,
                                   @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("Language model client initialized, base-url: {}, model: {}", baseUrl,
                properties.hasModel() ? properties.getModel() : "(provider default)");
    }

    @Override
    public String complete(LanguageModelRequest request) {
        long start = System.currentTimeMillis();
        var prompt = chatClient.prompt()
                .system(request.systemPrompt())
                .user(request.userMessage());
        if (properties.hasModel()) {
            prompt = prompt.options(OpenAiChatOptions.builder().model(properties.getModel()).build());
        }
        String response = prompt.call().content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("Model call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Language model returned empty content for classification."
                    + " Check that the model is running and supports JSON output.");
        }
        log.debug("Raw model response: {}", response);
        return response;
    }
}
