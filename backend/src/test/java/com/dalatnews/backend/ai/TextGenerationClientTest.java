package com.dalatnews.backend.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextGenerationClientTest {

    @Mock
    private ChatModel chatModel;

    @InjectMocks
    private TextGenerationClient client;

    @Test
    @DisplayName("System and user messages are sent with the requested model and token limit")
    void generate() {
        // given
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("{\"ok\": true}")))));

        // when
        String text = client.generate("system rules", "article text", "claude-haiku-4-5-20251001", 256);

        // then
        assertThat(text).isEqualTo("{\"ok\": true}");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        Prompt prompt = captor.getValue();
        assertThat(prompt.getInstructions()).extracting(Message::getMessageType)
                .containsExactly(MessageType.SYSTEM, MessageType.USER);
        assertThat(prompt.getInstructions().get(1).getText()).isEqualTo("article text");
        assertThat(prompt.getOptions().getModel()).isEqualTo("claude-haiku-4-5-20251001");
        assertThat(prompt.getOptions().getMaxTokens()).isEqualTo(256);
    }

    @Test
    @DisplayName("A reply without text is an AI response error")
    void emptyReply() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("")))));

        assertThatThrownBy(() -> client.generate("s", "u", "m", 10)).isInstanceOf(AiResponseException.class);
    }
}
