package com.purchasingpower.agentmail.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.agentmail.util.LogFormat;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama chat client. Runs the agent model locally through {@code /api/chat} in JSON mode.
 */
@Slf4j
@Component
public class OllamaClient implements LLMProvider {

    private static final String SYSTEM_MESSAGE =
            "You are an email assistant agent. Output only valid JSON. Do not include conversational filler.";

    private WebClient ollamaWebClient;

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${app.ollama.chat-model:qwen2.5:14b}")
    private String chatModel;

    @Value("${app.ollama.num-ctx:16384}")
    private int numCtx;

    @Value("${app.ollama.timeout:PT5M}")
    private Duration timeout;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(timeout)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + chatModel + ")";
    }

    @Override
    public String chat(String prompt, String agentName, String conversationId) {
        log.info("🔵 [LLM REQUEST] Provider=Ollama, Agent={}, Flow={}, Model={}", agentName, conversationId, chatModel);
        log.debug("🔵 [LLM REQUEST] Prompt length={}, First 200 chars: {}", prompt.length(), LogFormat.truncate(prompt, 200));

        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
                "model", chatModel,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_MESSAGE),
                        Map.of("role", "user", "content", prompt)
                ),
                "stream", false,
                "format", "json",
                "options", Map.of(
                        "num_ctx", numCtx,
                        "temperature", 0.2
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("message").path("content").asText();
            long latency = System.currentTimeMillis() - startTime;

            log.info("🟢 [LLM RESPONSE] Provider=Ollama, Latency={}ms, ResponseLength={}", latency, content.length());
            log.debug("🟢 [LLM RESPONSE] Content: {}", LogFormat.truncate(content, 500));
            return content;

        } catch (Exception e) {
            log.error("🔴 Ollama call failed for model {}: {}", chatModel, e.getMessage());
            throw new IllegalStateException("Ollama chat call failed. Ensure Ollama is running and "
                    + chatModel + " is downloaded.", e);
        }
    }
}
