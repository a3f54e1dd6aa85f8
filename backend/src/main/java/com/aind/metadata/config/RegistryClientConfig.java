package com.aind.metadata.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Shared WebClient for the registry clients. Redirects are followed and buffering is bounded.
 * Read timeouts are left to the lookup service so a slow call is cancelled, not reported.
 */
@Configuration
@Slf4j
public class RegistryClientConfig {

    @Value("${registry.per-call-timeout-ms:15000}")
    private long perCallTimeoutMs;

    @Value("${registry.max-in-memory-bytes:2097152}")
    private int maxInMemoryBytes;

    @Bean
    public WebClient registryWebClient() {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(perCallTimeoutMs, Integer.MAX_VALUE));

        log.info("Registry WebClient: connect timeout={}ms, maxInMemory={} bytes", perCallTimeoutMs, maxInMemoryBytes);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                .build();
    }
}
