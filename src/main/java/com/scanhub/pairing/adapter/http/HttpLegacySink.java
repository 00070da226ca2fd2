package com.scanhub.pairing.adapter.http;

import java.time.Duration;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.scanhub.pairing.adapter.LegacySink;
import com.scanhub.pairing.config.PairingHubProperties;
import com.scanhub.pairing.config.PairingHubProperties.LegacyMode;
import com.scanhub.pairing.exception.LegacySinkException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Legacy system reached over REST.
 *
 * POST {api-url}/api/v1/pairs with {@code {"platform": .., "product": ..}}; a 2xx answer
 * counts as saved unless its body carries {@code "success": false}. A 4xx/5xx answer is a
 * rejection; an unreachable host is a fault.
 */
@Component
@ConditionalOnProperty(prefix = "scanhub.pairing.legacy", name = "mode", havingValue = "HTTP")
@Slf4j
public class HttpLegacySink implements LegacySink {

    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration requestTimeout;

    public HttpLegacySink(WebClient.Builder webClientBuilder, PairingHubProperties properties) {
        String baseUrl = properties.getLegacy().getApiUrl();
        String apiKey = properties.getLegacy().getApiKey();

        WebClient.Builder builder = webClientBuilder
                .baseUrl(baseUrl + "/api/v1")
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE);

        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader("X-API-Key", apiKey);
        }

        this.webClient = builder.build();
        this.requestTimeout = properties.getLegacy().getRequestTimeout();

        log.info("LEGACY: HTTP legacy system at {}", baseUrl);
    }

    @Override
    public LegacyMode getMode() {
        return LegacyMode.HTTP;
    }

    @Override
    public SaveResult attemptSave(int platform, long product) {
        log.info("LEGACY: Saving pair {}-{}", platform, product);
        try {
            Map<String, Object> response = await(webClient.post()
                    .uri("/pairs")
                    .bodyValue(Map.of("platform", platform, "product", product))
                    .retrieve()
                    .bodyToMono(BODY_TYPE));

            if (response != null && Boolean.FALSE.equals(response.get("success"))) {
                Object message = response.getOrDefault("message", "rejected");
                log.error("LEGACY: Pair {}-{} rejected: {}", platform, product, message);
                return SaveResult.failure(String.valueOf(message));
            }

            log.info("LEGACY: Pair {}-{} saved", platform, product);
            return SaveResult.saved();

        } catch (WebClientResponseException e) {
            log.error("LEGACY: HTTP {} saving pair {}-{}", e.getStatusCode(), platform, product);
            return SaveResult.failure("HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (Exception e) {
            throw new LegacySinkException("Legacy system unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public ConnectionTestResult testConnection() {
        long startTime = System.currentTimeMillis();
        try {
            await(webClient.get()
                    .uri("/health")
                    .retrieve()
                    .toBodilessEntity());
            return ConnectionTestResult.success("Legacy system reachable", System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            log.warn("LEGACY: Connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failure(e.getMessage());
        }
    }

    private <T> T await(Mono<T> call) {
        return requestTimeout != null ? call.block(requestTimeout) : call.block();
    }
}
