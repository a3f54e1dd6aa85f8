package com.aind.metadata.client;

import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryEntry;
import com.aind.metadata.model.RegistryLookupResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * NCBI Gene through the E-utilities API: esearch for ids, then esummary for details.
 */
@Component
@Slf4j
public class NcbiGeneClient implements RegistryClient {

    static final String GENE_PAGE = "https://www.ncbi.nlm.nih.gov/gene/";
    private static final int MAX_IDS = 5;

    private final WebClient webClient;
    private final String baseUrl;

    public NcbiGeneClient(WebClient registryWebClient,
                          @Value("${registry.ncbi.base-url:https://eutils.ncbi.nlm.nih.gov/entrez/eutils}") String baseUrl) {
        this.webClient = registryWebClient;
        this.baseUrl = baseUrl;
    }

    @Override
    public Registry registry() {
        return Registry.NCBI_GENE;
    }

    @Override
    public Mono<RegistryLookupResult> lookup(String query) {
        URI searchUri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/esearch.fcgi")
                .queryParam("db", "gene")
                .queryParam("term", query)
                .queryParam("retmode", "json")
                .queryParam("retmax", MAX_IDS)
                .encode()
                .build()
                .toUri();

        return webClient.get()
                .uri(searchUri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .flatMap(search -> {
                    List<String> ids = new ArrayList<>();
                    search.path("esearchresult").path("idlist").forEach(id -> ids.add(id.asText()));
                    if (ids.isEmpty()) {
                        return Mono.just(notFound(query));
                    }
                    return summaries(query, ids);
                })
                .onErrorResume(WebClientException.class, e -> {
                    log.warn("NCBI gene lookup failed for '{}': {}", query, e.getMessage());
                    return Mono.just(RegistryLookupResult.failed(Registry.NCBI_GENE, query, e.getMessage()));
                });
    }

    private Mono<RegistryLookupResult> summaries(String query, List<String> ids) {
        URI summaryUri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/esummary.fcgi")
                .queryParam("db", "gene")
                .queryParam("id", String.join(",", ids))
                .queryParam("retmode", "json")
                .encode()
                .build()
                .toUri();

        return webClient.get()
                .uri(summaryUri)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(summary -> {
                    JsonNode byId = summary.path("result");
                    List<RegistryEntry> genes = new ArrayList<>();
                    for (String id : ids) {
                        JsonNode info = byId.path(id);
                        genes.add(RegistryEntry.builder()
                                .geneId(id)
                                .symbol(info.path("name").asText(""))
                                .description(info.path("description").asText(""))
                                .organism(info.path("organism").path("scientificname").asText(""))
                                .url(GENE_PAGE + id)
                                .build());
                    }
                    return RegistryLookupResult.builder()
                            .registry(Registry.NCBI_GENE)
                            .query(query)
                            .found(true)
                            .results(genes)
                            .build();
                });
    }

    private RegistryLookupResult notFound(String query) {
        return RegistryLookupResult.builder()
                .registry(Registry.NCBI_GENE)
                .query(query)
                .found(false)
                .build();
    }
}
