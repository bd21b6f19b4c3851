package com.purchasingpower.bookflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import com.purchasingpower.bookflow.configuration.OllamaProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama provider using the local /api/chat endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OllamaClient implements LLMProvider {

    private final BookFlowProperties properties;
    private WebClient ollamaWebClient;

    @PostConstruct
    public void init() {
        OllamaProperties ollama = properties.getOllama();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(ollama.getTimeoutSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(ollama.getTimeoutSeconds(), TimeUnit.SECONDS)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + properties.getOllama().getChatModel() + ")";
    }

    @Override
    public String chat(List<ChatMessage> messages, double temperature, int maxTokens) {
        String model = properties.getOllama().getChatModel();
        log.info("🔵 [LLM REQUEST] Provider=Ollama, Model={}, Messages={}", model, messages.size());

        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", toPayload(messages),
                "stream", false,
                "options", Map.of(
                        "temperature", temperature,
                        "num_predict", maxTokens
                )
        );

        JsonNode response;
        try {
            response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (Exception e) {
            log.error("🔴 Ollama call failed for model {}: {}", model, e.getMessage());
            throw LLMProviderException.from("Ollama", e);
        }

        String content = response == null ? "" : response.path("message").path("content").asText("").trim();
        if (content.isEmpty()) {
            throw new LLMProviderException(FailureKind.MALFORMED_OUTPUT, "Ollama returned an empty message");
        }

        long latency = System.currentTimeMillis() - startTime;
        log.info("🟢 [LLM RESPONSE] Provider=Ollama, Latency={}ms, ResponseLength={}", latency, content.length());
        log.debug("🟢 [LLM RESPONSE] Content: {}", content.substring(0, Math.min(200, content.length())));
        return content;
    }

    static List<Map<String, String>> toPayload(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> Map.of("role", m.getRole(), "content", m.getContent()))
                .toList();
    }
}
