package com.whereq.tally.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Outbound HTTP for the REST extractor and the event webhook. Response time-outs
 * are applied per call by the callers.
 */
@Configuration
public class WebClientConfig {

    @Bean
    @Scope("prototype")
    public WebClient.Builder webClientBuilder(TallyProperties properties) {
        TallyProperties.HttpConfig http = properties.getHttp();

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis());

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, http.getUserAgent())
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(http.getMaxInMemorySize()));
    }
}
