package com.aind.metadata.client;

import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryEntry;
import com.aind.metadata.model.RegistryLookupResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Plasmid catalog lookups. A bare catalog number is tried against its detail page first;
 * everything else goes through the catalog search page.
 */
@Component
@Slf4j
public class AddgeneClient implements RegistryClient {

    private final WebClient webClient;
    private final String baseUrl;
    private final AddgeneResultParser parser;

    public AddgeneClient(WebClient registryWebClient,
                         @Value("${registry.addgene.base-url:https://www.addgene.org}") String baseUrl) {
        this.webClient = registryWebClient;
        this.baseUrl = baseUrl;
        this.parser = new AddgeneResultParser(baseUrl);
    }

    @Override
    public Registry registry() {
        return Registry.ADDGENE;
    }

    @Override
    public Mono<RegistryLookupResult> lookup(String query) {
        String trimmed = query.trim();
        Mono<RegistryLookupResult> lookup = isCatalogNumber(trimmed)
                ? detailPage(query, trimmed).switchIfEmpty(Mono.defer(() -> search(query)))
                : search(query);

        return lookup.onErrorResume(WebClientException.class, e -> {
            log.warn("Addgene lookup failed for '{}': {}", query, e.getMessage());
            return Mono.just(RegistryLookupResult.failed(Registry.ADDGENE, query, e.getMessage()));
        });
    }

    private Mono<RegistryLookupResult> detailPage(String query, String catalogNumber) {
        String url = parser.plasmidUrl(catalogNumber);
        return webClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> {
                    if (response.statusCode().value() != 200) {
                        return response.releaseBody().then(Mono.<RegistryLookupResult>empty());
                    }
                    RegistryEntry entry = RegistryEntry.builder()
                            .catalogNumber(catalogNumber)
                            .url(url)
                            .build();
                    return response.releaseBody().thenReturn(RegistryLookupResult.builder()
                            .registry(Registry.ADDGENE)
                            .query(query)
                            .found(true)
                            .results(List.of(entry))
                            .url(url)
                            .statusCode(200)
                            .build());
                });
    }

    private Mono<RegistryLookupResult> search(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/search/catalog/plasmids/")
                .queryParam("q", query)
                .encode()
                .build()
                .toUri();

        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> response.bodyToMono(String.class).defaultIfEmpty(""))
                .map(page -> {
                    List<RegistryEntry> plasmids = parser.parse(page);
                    log.debug("Addgene search '{}' returned {} plasmids", query, plasmids.size());
                    return RegistryLookupResult.builder()
                            .registry(Registry.ADDGENE)
                            .query(query)
                            .found(!plasmids.isEmpty())
                            .results(plasmids)
                            .url(uri.toString())
                            .build();
                });
    }

    private static boolean isCatalogNumber(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
