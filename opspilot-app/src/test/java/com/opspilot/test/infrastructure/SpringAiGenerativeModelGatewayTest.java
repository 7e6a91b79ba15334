package com.opspilot.test.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opspilot.infrastructure.ai.SpringAiGenerativeModelGateway;
import com.opspilot.infrastructure.util.JsonCodec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SpringAiGenerativeModelGatewayTest {

    @Test
    @SuppressWarnings("unchecked")
    public void shouldStayOfflineForMockProvider() {
        ObjectProvider<ChatModel> provider = mock(ObjectProvider.class);

        SpringAiGenerativeModelGateway gateway = gateway(provider, "mock");

        Assertions.assertNull(gateway.generateJson("plan this"));
        Assertions.assertNull(gateway.generateText("phrase this"));
        Assertions.assertEquals("mock", gateway.getModelName());
        verify(provider, never()).getIfAvailable();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldStayOfflineWhenNoChatModelConfigured() {
        ObjectProvider<ChatModel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);

        SpringAiGenerativeModelGateway gateway = gateway(provider, "openai");

        Assertions.assertNull(gateway.generateJson("plan this"));
        Assertions.assertEquals("openai", gateway.getModelName());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldAbsorbModelFailures() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("connection reset"));
        ObjectProvider<ChatModel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(chatModel);

        SpringAiGenerativeModelGateway gateway = gateway(provider, "openai");

        Assertions.assertNull(gateway.generateJson("plan this"));
        Assertions.assertNull(gateway.generateText("phrase this"));
        Assertions.assertEquals("gpt-4o-mini", gateway.getModelName());
    }

    private SpringAiGenerativeModelGateway gateway(ObjectProvider<ChatModel> provider, String providerName) {
        return new SpringAiGenerativeModelGateway(provider, new JsonCodec(new ObjectMapper()), providerName,
                "gpt-4o-mini", "Return only valid JSON.", "Answer concisely.");
    }
}
