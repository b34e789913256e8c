package com.whereq.tally.executor;

import com.whereq.tally.exception.UnsupportedMethodException;
import com.whereq.tally.model.ExtractedData;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractorRegistryTest {

    private static Extractor extractor(String method) {
        return new Extractor() {
            @Override
            public String getMethod() {
                return method;
            }

            @Override
            public ExtractedData extract(ExtractionParams params) {
                return ExtractedData.builder().jobId(params.getJob().getId()).build();
            }
        };
    }

    @Test
    void shouldResolveRegisteredExtractors() {
        Extractor api = extractor("api");
        Extractor sftp = extractor("sftp");
        ExtractorRegistry registry = new ExtractorRegistry(List.of(api, sftp));

        assertThat(registry.get("api")).isSameAs(api);
        assertThat(registry.supports("sftp")).isTrue();
        assertThat(registry.getMethods()).containsExactly("api", "sftp");
    }

    @Test
    void unknownMethodShouldBeUnsupported() {
        ExtractorRegistry registry = new ExtractorRegistry(List.of(extractor("api")));

        assertThat(registry.supports("browser")).isFalse();
        assertThat(registry.supports(null)).isFalse();
        assertThatThrownBy(() -> registry.get("browser"))
            .isInstanceOf(UnsupportedMethodException.class)
            .hasMessageContaining("browser");
    }

    @Test
    void laterRegistrationShouldReplace() {
        ExtractorRegistry registry = new ExtractorRegistry(List.of(extractor("api")));
        Extractor replacement = extractor("api");

        registry.register(replacement);

        assertThat(registry.get("api")).isSameAs(replacement);
        assertThat(registry.getMethods()).containsExactly("api");
    }
}
