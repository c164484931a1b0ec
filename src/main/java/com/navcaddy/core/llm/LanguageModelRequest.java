package com.navcaddy.core.llm;

/**
 * One classification request to the language model.
 *
 * @param systemPrompt persona and output-format instructions
 * @param contextBlock rendered session context, possibly empty
 * @param userInput    normalized user utterance
 */
public record LanguageModelRequest(
    String systemPrompt,
    String contextBlock,
    String userInput
) {

    /**
     * The user message as sent to the model: context block (if any) followed by the utterance.
     */
    public String userMessage() {
        if (contextBlock == null || contextBlock.isBlank()) {
            return "# User Input\n" + userInput;
        }
        return contextBlock + "\n\n# User Input\n" + userInput;
    }
}
