package com.dalatnews.backend.ai;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

/**
 * Narrow request/response access to the chat model: one system instruction, one user
 * message, text back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TextGenerationClient {

    private final ChatModel chatModel;

    /**
     * @throws AiResponseException when the model returns no text
     */
    public String generate(String systemPrompt, String userPrompt, String model, int maxTokens) {
        ChatOptions options = ChatOptions.builder()
                .model(model)
                .maxTokens(maxTokens)
                .build();
        Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)), options);

        ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AiResponseException("No text response from " + model);
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new AiResponseException("Empty text response from " + model);
        }
        log.debug("{} returned {} chars", model, text.length());
        return text;
    }
}
