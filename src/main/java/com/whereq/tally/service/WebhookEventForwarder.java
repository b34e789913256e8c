package com.whereq.tally.service;

import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.model.JobEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Service for forwarding lifecycle events to a webhook
 */
@Slf4j
@Service
public class WebhookEventForwarder {

    @Autowired
    private WebClient.Builder webClientBuilder;

    @Autowired
    private JobEventBus eventBus;

    @Autowired
    private TallyProperties properties;

    private JobEventBus.Subscription subscription;

    @PostConstruct
    public void initialize() {
        String webhookUrl = properties.getEvents().getWebhookUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            log.info("No event webhook configured");
            return;
        }
        subscription = eventBus.subscribeAll(event -> forward(webhookUrl, event).subscribe());
        log.info("Forwarding job events to {}", webhookUrl);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    /**
     * POST one event
     *
     * @param webhookUrl webhook URL
     * @param event lifecycle event
     * @return Mono that completes when the notification is sent or has failed
     */
    public Mono<Void> forward(String webhookUrl, JobEvent event) {
        Duration timeout = properties.getEvents().getWebhookTimeout();

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(event))
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> log.debug("Webhook notification sent for job {}: {} - {}",
                event.getJobId(), event.getType().getWireName(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                event.getJobId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail the job if the webhook fails
            .then();
    }

    private Map<String, Object> buildPayload(JobEvent event) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event", event.getType().getWireName());
        payload.put("jobId", event.getJobId());
        payload.put("timestamp", event.getTimestamp() != null ? event.getTimestamp().toEpochMilli() : System.currentTimeMillis());
        if (event.getAttempt() != null) {
            payload.put("attempt", event.getAttempt());
        }
        if (event.getError() != null) {
            payload.put("error", event.getError());
        }
        if (event.getPercentage() != null) {
            payload.put("percentage", event.getPercentage());
        }
        if (event.getData() != null) {
            payload.put("data", event.getData());
        }
        return payload;
    }
}
