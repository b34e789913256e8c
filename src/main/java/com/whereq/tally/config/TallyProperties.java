package com.whereq.tally.config;

import com.whereq.tally.model.BackoffStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Tally.
 *
 * @author WhereQ Inc.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "tally")
public class TallyProperties {

    @Valid
    private EncryptionConfig encryption = new EncryptionConfig();

    @Valid
    private VaultConfig vault = new VaultConfig();

    @Valid
    private QueueConfig queue = new QueueConfig();

    @Valid
    private SchedulerConfig scheduler = new SchedulerConfig();

    @Valid
    private EventsConfig events = new EventsConfig();

    @Valid
    private RetryDefaults retry = new RetryDefaults();

    @Valid
    private HttpConfig http = new HttpConfig();

    @Data
    public static class EncryptionConfig {
        /**
         * Hex-encoded 32-byte master key. When absent an ephemeral key is generated.
         */
        private String masterKey;

        /**
         * PBKDF2 iterations used to derive per-blob keys.
         */
        @Min(1)
        private int iterations = 100_000;
    }

    @Data
    public static class VaultConfig {
        /**
         * Credential storage backend.
         * MEMORY: process-local map, lost on restart (default)
         * REDIS: encrypted entries persisted in Redis
         */
        private StoreType store = StoreType.MEMORY;

        /**
         * Key prefix for the Redis store.
         */
        private String keyPrefix = "tally:vault:";
    }

    @Data
    public static class QueueConfig {
        /**
         * Queue that extraction attempts are delivered through.
         */
        @NotBlank
        private String name = "extraction-jobs";

        /**
         * Maximum concurrent extractions.
         */
        @Min(1)
        private int concurrency = 5;

        /**
         * How long a leased task is held before it is considered stalled.
         */
        private Duration lockDuration = Duration.ofSeconds(30);

        /**
         * How often leases are checked for expiry.
         */
        private Duration stalledInterval = Duration.ofSeconds(30);

        /**
         * Re-deliveries allowed for a stalled task before it fails.
         */
        @Min(0)
        private int maxStalledCount = 1;

        /**
         * Dispatcher polling interval.
         */
        private Duration pollInterval = Duration.ofMillis(200);

        /**
         * Completed tasks older than this are pruned by the periodic clean.
         */
        private Duration completedRetention = Duration.ofHours(24);

        /**
         * Failed tasks older than this are pruned by the periodic clean.
         */
        private Duration failedRetention = Duration.ofDays(7);

        /**
         * How often terminal tasks are pruned.
         */
        private Duration cleanInterval = Duration.ofHours(1);
    }

    @Data
    public static class SchedulerConfig {
        /**
         * Timer threads. Timers only enqueue, so a small pool is enough.
         */
        @Min(1)
        private int poolSize = 2;

        /**
         * Timezone used when a job does not declare one.
         */
        @NotBlank
        private String defaultTimezone = "UTC";
    }

    @Data
    public static class EventsConfig {
        /**
         * Optional URL that receives every lifecycle event as JSON.
         */
        private String webhookUrl;

        private Duration webhookTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class RetryDefaults {
        @Min(1)
        private int maxAttempts = 3;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        @Min(0)
        private long initialDelayMs = 5000;
        @Min(0)
        private long maxDelayMs = 60000;
        private List<String> retryableErrors = new ArrayList<>(List.of("NETWORK_ERROR", "TIMEOUT"));
    }

    @Data
    public static class HttpConfig {
        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Largest response body buffered in memory, in bytes.
         */
        @Min(1)
        private int maxInMemorySize = 32 * 1024 * 1024;

        @NotBlank
        private String userAgent = "WhereQ-Tally/0.1";
    }

    public enum StoreType {
        MEMORY,
        REDIS
    }
}
