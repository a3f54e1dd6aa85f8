package com.aind.metadata.client;

import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryLookupResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Mouse Genome Informatics quick search. MGI has no JSON API for this, so a 200 on the
 * exact-phrase summary page counts as found and the page URL is handed back.
 */
@Component
@Slf4j
public class MgiClient implements RegistryClient {

    private final WebClient webClient;
    private final String baseUrl;

    public MgiClient(WebClient registryWebClient,
                     @Value("${registry.mgi.base-url:https://www.informatics.jax.org}") String baseUrl) {
        this.webClient = registryWebClient;
        this.baseUrl = baseUrl;
    }

    @Override
    public Registry registry() {
        return Registry.MGI;
    }

    @Override
    public Mono<RegistryLookupResult> lookup(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/quicksearch/summary")
                .queryParam("queryType", "exactPhrase")
                .queryParam("query", query)
                .encode()
                .build()
                .toUri();

        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    return response.releaseBody().thenReturn(RegistryLookupResult.builder()
                            .registry(Registry.MGI)
                            .query(query)
                            .statusCode(status)
                            .url(uri.toString())
                            .found(status == 200)
                            .build());
                })
                .onErrorResume(WebClientException.class, e -> {
                    log.warn("MGI lookup failed for '{}': {}", query, e.getMessage());
                    return Mono.just(RegistryLookupResult.failed(Registry.MGI, query, e.getMessage()));
                });
    }
}
