package com.whereq.tally.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.model.JobEvent;
import com.whereq.tally.model.JobEventType;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookEventForwarderTest {

    private MockWebServer mockWebServer;
    private JobEventBus eventBus;
    private TallyProperties properties;
    private WebhookEventForwarder forwarder;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        eventBus = new JobEventBus();
        properties = new TallyProperties();
        forwarder = new WebhookEventForwarder();
        ReflectionTestUtils.setField(forwarder, "webClientBuilder", WebClient.builder());
        ReflectionTestUtils.setField(forwarder, "eventBus", eventBus);
        ReflectionTestUtils.setField(forwarder, "properties", properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        forwarder.stop();
        mockWebServer.shutdown();
    }

    private JobEvent failedEvent() {
        return JobEvent.builder()
            .type(JobEventType.JOB_FAILED)
            .jobId("daily-ach")
            .timestamp(Instant.ofEpochMilli(1_709_258_400_000L))
            .attempt(2)
            .error("NETWORK_ERROR: HTTP 503")
            .data(Map.of("willRetry", true))
            .build();
    }

    @Test
    @DisplayName("Should POST event payload with wire name")
    void shouldPostPayload() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(204));
        String url = mockWebServer.url("/hooks/tally").toString();

        StepVerifier.create(forwarder.forward(url, failedEvent()))
            .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.get("event").asText()).isEqualTo("job:failed");
        assertThat(body.get("jobId").asText()).isEqualTo("daily-ach");
        assertThat(body.get("timestamp").asLong()).isEqualTo(1_709_258_400_000L);
        assertThat(body.get("attempt").asInt()).isEqualTo(2);
        assertThat(body.get("error").asText()).isEqualTo("NETWORK_ERROR: HTTP 503");
        assertThat(body.get("data").get("willRetry").asBoolean()).isTrue();
        assertThat(body.has("percentage")).isFalse();
    }

    @Test
    @DisplayName("Should swallow webhook failures")
    void shouldCompleteOnServerError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        StepVerifier.create(forwarder.forward(mockWebServer.url("/hooks").toString(), failedEvent()))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should forward bus events when a webhook is configured")
    void shouldSubscribeWhenConfigured() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));
        properties.getEvents().setWebhookUrl(mockWebServer.url("/hooks").toString());

        forwarder.initialize();
        eventBus.publish(JobEvent.of(JobEventType.JOB_COMPLETED, "daily-ach"));

        RecordedRequest request = mockWebServer.takeRequest(2, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getBody().readUtf8()).contains("\"event\":\"job:completed\"");
    }

    @Test
    @DisplayName("Should stay detached without a webhook url")
    void shouldNotSubscribeWithoutUrl() {
        forwarder.initialize();

        assertThat(eventBus.getSubscriberCount()).isZero();
    }
}
