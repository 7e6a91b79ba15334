package com.opspilot.infrastructure.ai;

import com.opspilot.domain.ai.adapter.gateway.IGenerativeModelGateway;
import com.opspilot.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 基于 Spring AI ChatClient 的生成式模型网关。
 * <p>
 * provider 为 mock 或容器中没有 ChatModel 时不发起调用；任何调用异常都被吸收为“无结果”。
 * </p>
 */
@Slf4j
@Component
public class SpringAiGenerativeModelGateway implements IGenerativeModelGateway {

    static final String MOCK_PROVIDER = "mock";

    private final ChatClient chatClient;
    private final JsonCodec jsonCodec;
    private final String provider;
    private final String modelName;
    private final String jsonSystemPrompt;
    private final String textSystemPrompt;

    public SpringAiGenerativeModelGateway(ObjectProvider<ChatModel> chatModelProvider,
                                          JsonCodec jsonCodec,
                                          @Value("${opspilot.ai.provider:mock}") String provider,
                                          @Value("${opspilot.ai.model:gpt-4o-mini}") String modelName,
                                          @Value("${opspilot.ai.json-system-prompt:Return only valid JSON.}") String jsonSystemPrompt,
                                          @Value("${opspilot.ai.text-system-prompt:Answer accurately and concisely based only on the provided data. "
                                                  + "Return plain natural language only (no JSON, no markdown code fences).}") String textSystemPrompt) {
        this.jsonCodec = jsonCodec;
        this.provider = StringUtils.defaultIfBlank(provider, MOCK_PROVIDER).trim().toLowerCase(Locale.ROOT);
        this.modelName = StringUtils.defaultIfBlank(modelName, "gpt-4o-mini");
        this.jsonSystemPrompt = jsonSystemPrompt;
        this.textSystemPrompt = textSystemPrompt;
        ChatModel chatModel = MOCK_PROVIDER.equals(this.provider) ? null : chatModelProvider.getIfAvailable();
        this.chatClient = chatModel == null ? null : ChatClient.builder(chatModel).build();
        log.info("AI_GATEWAY_READY provider={}, model={}, enabled={}", this.provider, this.modelName, chatClient != null);
    }

    @Override
    public Map<String, Object> generateJson(String instruction) {
        String content = call(jsonSystemPrompt, instruction);
        if (content == null) {
            return null;
        }
        Map<String, Object> payload = jsonCodec.readObjectLeniently(content);
        if (payload == null) {
            log.warn("AI_JSON_INVALID model={}, length={}", modelName, content.length());
        }
        return payload;
    }

    @Override
    public String generateText(String instruction) {
        return call(textSystemPrompt, instruction);
    }

    @Override
    public String getModelName() {
        return chatClient == null ? provider : modelName;
    }

    private String call(String systemPrompt, String instruction) {
        if (chatClient == null || StringUtils.isBlank(instruction)) {
            return null;
        }
        try {
            ChatClient.CallResponseSpec response = chatClient.prompt()
                    .system(systemPrompt)
                    .user(instruction)
                    .options(ChatOptions.builder().model(modelName).build())
                    .call();
            String content = response == null ? null : response.content();
            return StringUtils.trimToNull(content);
        } catch (Exception ex) {
            log.warn("AI_CALL_FAILED model={}, error={}", modelName, ex.getMessage());
            return null;
        }
    }
}
