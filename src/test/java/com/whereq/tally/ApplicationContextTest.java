package com.whereq.tally;

import com.whereq.tally.config.TallyProperties;
import com.whereq.tally.executor.ExtractorRegistry;
import com.whereq.tally.executor.RestApiExtractor;
import com.whereq.tally.model.CredentialData;
import com.whereq.tally.model.CredentialType;
import com.whereq.tally.model.Job;
import com.whereq.tally.model.JobStatus;
import com.whereq.tally.service.ExtractionOrchestrator;
import com.whereq.tally.support.TestJobs;
import com.whereq.tally.vault.CredentialStore;
import com.whereq.tally.vault.CredentialVault;
import com.whereq.tally.vault.InMemoryCredentialStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

    @Autowired
    private TallyProperties properties;

    @Autowired
    private ExtractorRegistry extractorRegistry;

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private CredentialVault vault;

    @Autowired
    private ExtractionOrchestrator orchestrator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void shouldBindTestConfiguration() {
        assertThat(properties.getEncryption().getIterations()).isEqualTo(1000);
        assertThat(properties.getQueue().getName()).isEqualTo("extraction-jobs");
        assertThat(credentialStore).isInstanceOf(InMemoryCredentialStore.class);
    }

    @Test
    void shouldRegisterRestExtractor() {
        assertThat(extractorRegistry.getMethods()).contains(RestApiExtractor.METHOD);
    }

    @Test
    void shouldRegisterMeters() {
        assertThat(meterRegistry.find("tally.jobs.completed").counter()).isNotNull();
        assertThat(meterRegistry.find("tally.queue.waiting").gauge()).isNotNull();
    }

    @Test
    void shouldStoreCredentialsAndScheduleJob() {
        CredentialData credentials = CredentialData.builder().type(CredentialType.API_KEY).key("k-ctx").build();
        StepVerifier.create(vault.store("vault-ctx-job", credentials).then(vault.retrieve("vault-ctx-job")))
            .assertNext(c -> assertThat(c.getKey()).isEqualTo("k-ctx"))
            .verifyComplete();

        Job job = TestJobs.job("ctx-job", RestApiExtractor.METHOD);
        job.getSchedule().setEnabled(false);

        StepVerifier.create(orchestrator.scheduleJob(job).then(orchestrator.getJobStatus("ctx-job")))
            .assertNext(status -> {
                assertThat(status.getStatus()).isEqualTo(JobStatus.PAUSED);
                assertThat(status.getNextRunAt()).isNull();
            })
            .verifyComplete();
    }
}
