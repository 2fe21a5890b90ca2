package com.example.reminderscheduler.client;

import com.example.reminderscheduler.client.ClientModels.SendMessageRequest;
import com.example.reminderscheduler.client.ClientModels.SendMessageResponse;
import com.example.reminderscheduler.config.ChatGatewayProperties;
import com.example.reminderscheduler.exception.DispatchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for the chat gateway that posts messages to channels and users.
 * <p>
 * Guarded by a Resilience4j circuit breaker. Sends are not retried here: a retry after
 * an ambiguous failure could post the reminder twice.
 */
@Slf4j
@Component
public class ChatGatewayClient {

    private static final String SERVICE_NAME = "Chat Gateway";

    private final WebClient webClient;
    private final Duration timeout;

    public ChatGatewayClient(@Qualifier("chatGatewayWebClient") WebClient webClient,
                             ChatGatewayProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    /**
     * Post a message to a channel
     *
     * @throws DispatchException if the API call fails
     */
    @CircuitBreaker(name = "chatGateway", fallbackMethod = "sendFallback")
    public SendMessageResponse sendToChannel(String channelId, SendMessageRequest request) {
        log.debug("Posting reminder to channel {}", channelId);
        return post("/api/v1/channels/{targetId}/messages", channelId, request);
    }

    /**
     * Send a direct message to a user
     *
     * @throws DispatchException if the API call fails
     */
    @CircuitBreaker(name = "chatGateway", fallbackMethod = "sendFallback")
    public SendMessageResponse sendDirectMessage(String userId, SendMessageRequest request) {
        log.debug("Sending reminder as direct message to user {}", userId);
        return post("/api/v1/users/{targetId}/messages", userId, request);
    }

    private SendMessageResponse post(String uri, String targetId, SendMessageRequest request) {
        try {
            return webClient.post()
                    .uri(uri, targetId)
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new DispatchException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(SendMessageResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (DispatchException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to send message to {}: {}", targetId, e.getMessage());
            throw new DispatchException(SERVICE_NAME, e.getMessage(), e);
        }
    }

    /**
     * Fallback method when the circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private SendMessageResponse sendFallback(String targetId, SendMessageRequest request, Exception e) {
        if (e instanceof DispatchException dispatchException) {
            throw dispatchException;
        }
        log.warn("Circuit breaker open for Chat Gateway, target: {}, error: {}", targetId, e.getMessage());
        throw new DispatchException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
