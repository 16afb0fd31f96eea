package com.aicmd.cache.translation;

import com.aicmd.cache.translation.dto.ChatCompletionRequest;
import com.aicmd.cache.translation.dto.ChatCompletionResponse;
import com.aicmd.cache.translation.dto.ChatMessage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class ChatCompletionTranslationClient implements TranslationClient {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionTranslationClient.class);

    private final RestTemplate restTemplate;
    private final TranslationProperties properties;

    public ChatCompletionTranslationClient(
        @Qualifier("translationRestTemplate") RestTemplate restTemplate,
        TranslationProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public String translate(String query) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new TranslationException("translation api key not configured (aicmd.translation.api-key)");
        }
        if (properties.getModel() == null || properties.getModel().isBlank()) {
            throw new TranslationException("translation model not configured (aicmd.translation.model)");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new TranslationException("translation baseUrl not configured");
        }

        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(properties.getModel());
        request.setMessages(List.of(
            new ChatMessage("system", properties.getSystemPrompt()),
            new ChatMessage("user", query)
        ));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());
        HttpEntity<ChatCompletionRequest> entity = new HttpEntity<>(request, headers);

        ChatCompletionResponse body;
        try {
            ResponseEntity<ChatCompletionResponse> response = restTemplate.exchange(
                buildUrl("/v1/chat/completions"),
                HttpMethod.POST,
                entity,
                ChatCompletionResponse.class
            );
            body = response.getBody();
        } catch (ResourceAccessException e) {
            throw new TranslationException("translation service unreachable: " + e.getMessage(), e);
        } catch (HttpStatusCodeException e) {
            throw new TranslationException(describe(e), e);
        } catch (RestClientException e) {
            throw new TranslationException("translation request failed: " + e.getMessage(), e);
        }

        String command = extractCommand(body);
        log.debug("translation received model={} length={}", properties.getModel(), command.length());
        return command;
    }

    static String extractCommand(ChatCompletionResponse body) {
        if (body == null || body.getChoices() == null || body.getChoices().isEmpty()) {
            throw new TranslationException("translation response has no choices");
        }
        ChatMessage message = body.getChoices().get(0).getMessage();
        if (message == null || message.getContent() == null) {
            throw new TranslationException("translation response has no message content");
        }
        String command = stripFormatting(message.getContent());
        if (command.isEmpty()) {
            throw new TranslationException("translation response is empty");
        }
        return command;
    }

    static String stripFormatting(String content) {
        String text = content.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? text.substring(3) : text.substring(firstNewline + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
            text = text.strip();
        }
        if (text.length() >= 2 && text.startsWith("`") && text.endsWith("`")) {
            text = text.substring(1, text.length() - 1).strip();
        }
        return text;
    }

    private static String describe(HttpStatusCodeException e) {
        if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
            return "translation api key rejected";
        }
        if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return "translation rate limit exceeded";
        }
        return "translation service error: " + e.getStatusCode();
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
