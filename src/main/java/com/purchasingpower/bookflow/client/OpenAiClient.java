package com.purchasingpower.bookflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.configuration.OpenAiProperties;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible provider using the /chat/completions endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiClient implements LLMProvider {

    private final BookFlowProperties properties;
    private WebClient openAiWebClient;

    @PostConstruct
    public void init() {
        OpenAiProperties openai = properties.getOpenai();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(Duration.ofSeconds(openai.getTimeoutSeconds()));

        this.openAiWebClient = WebClient.builder()
                .baseUrl(openai.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "OpenAI (" + properties.getOpenai().getModel() + ")";
    }

    @Override
    public String chat(List<ChatMessage> messages, double temperature, int maxTokens) {
        OpenAiProperties openai = properties.getOpenai();
        if (openai.getApiKey() == null || openai.getApiKey().isBlank()) {
            throw new LLMProviderException(FailureKind.NOT_CONFIGURED,
                    "OpenAI API key is not configured (bookflow.openai.api-key)");
        }

        log.info("🔵 [LLM REQUEST] Provider=OpenAI, Model={}, Messages={}", openai.getModel(), messages.size());
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
                "model", openai.getModel(),
                "messages", OllamaClient.toPayload(messages),
                "temperature", temperature,
                "max_tokens", maxTokens
        );

        JsonNode response;
        try {
            response = openAiWebClient.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + openai.getApiKey())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (Exception e) {
            log.error("🔴 OpenAI call failed for model {}: {}", openai.getModel(), e.getMessage());
            throw LLMProviderException.from("OpenAI", e);
        }

        String content = response == null ? ""
                : response.path("choices").path(0).path("message").path("content").asText("").trim();
        if (content.isEmpty()) {
            throw new LLMProviderException(FailureKind.MALFORMED_OUTPUT, "OpenAI returned no choices");
        }

        log.info("🟢 [LLM RESPONSE] Provider=OpenAI, Latency={}ms, ResponseLength={}",
                System.currentTimeMillis() - startTime, content.length());
        return content;
    }
}
