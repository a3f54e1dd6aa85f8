package com.aind.metadata.service;

import com.aind.metadata.client.RegistryClient;
import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryLookupResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs registry lookups concurrently under a per-call timeout and an overall deadline.
 * Failed, timed-out and cancelled calls are left out; the rest come back in query order.
 */
@Service
@Slf4j
public class RegistryLookupService {

    private final Map<Registry, RegistryClient> clients = new EnumMap<>(Registry.class);
    private final Duration perCallTimeout;
    private final Duration overallTimeout;
    private final int maxConcurrency;

    public RegistryLookupService(List<RegistryClient> registryClients,
                                 @Value("${registry.per-call-timeout-ms:15000}") long perCallTimeoutMs,
                                 @Value("${registry.overall-timeout-ms:20000}") long overallTimeoutMs,
                                 @Value("${registry.max-concurrency:8}") int maxConcurrency) {
        for (RegistryClient client : registryClients) {
            clients.put(client.registry(), client);
        }
        this.perCallTimeout = Duration.ofMillis(perCallTimeoutMs);
        this.overallTimeout = Duration.ofMillis(overallTimeoutMs);
        this.maxConcurrency = Math.max(1, maxConcurrency);
        log.info("Registry lookups: clients={}, perCall={}ms, overall={}ms, maxConcurrency={}",
                clients.keySet(), perCallTimeoutMs, overallTimeoutMs, this.maxConcurrency);
    }

    public List<RegistryLookupResult> runLookups(Map<Registry, List<String>> queries) {
        return runLookups(queries, perCallTimeout, overallTimeout);
    }

    /**
     * Blocking form of {@link #lookups}. Never throws for lookup failures.
     */
    public List<RegistryLookupResult> runLookups(Map<Registry, List<String>> queries,
                                                 Duration perCall, Duration overall) {
        List<RegistryLookupResult> results = lookups(queries, perCall, overall).block();
        return results == null ? Collections.emptyList() : results;
    }

    public Mono<List<RegistryLookupResult>> lookups(Map<Registry, List<String>> queries,
                                                   Duration perCall, Duration overall) {
        List<LookupTask> tasks = plan(queries);
        if (tasks.isEmpty()) {
            return Mono.just(Collections.emptyList());
        }

        long started = System.currentTimeMillis();
        Mono<Long> deadline = Mono.delay(overall)
                .doOnNext(tick -> log.warn("Registry lookups hit the {}ms deadline; outstanding calls cancelled",
                        overall.toMillis()));

        return Flux.fromIterable(tasks)
                .flatMap(task -> call(task, perCall), maxConcurrency)
                .takeUntilOther(deadline)
                .collectList()
                .map(completed -> {
                    List<RegistryLookupResult> ordered = completed.stream()
                            .sorted(Comparator.comparingInt(CompletedLookup::getIndex))
                            .map(CompletedLookup::getResult)
                            .collect(Collectors.toList());
                    log.info("Registry lookups completed: {}/{} returned in {}ms",
                            ordered.size(), tasks.size(), System.currentTimeMillis() - started);
                    return ordered;
                });
    }

    private Mono<CompletedLookup> call(LookupTask task, Duration perCall) {
        return Mono.defer(() -> task.getClient().lookup(task.getQuery()))
                .timeout(perCall)
                .map(result -> {
                    if (result.getRegistry() == null) {
                        result.setRegistry(task.getClient().registry());
                    }
                    if (result.getQuery() == null) {
                        result.setQuery(task.getQuery());
                    }
                    return new CompletedLookup(task.getIndex(), result);
                })
                .onErrorResume(e -> {
                    log.warn("Registry lookup failed for {}/{}: {}",
                            task.getClient().registry().getValue(), task.getQuery(), e.toString());
                    return Mono.empty();
                });
    }

    private List<LookupTask> plan(Map<Registry, List<String>> queries) {
        List<LookupTask> tasks = new ArrayList<>();
        if (queries == null) {
            return tasks;
        }
        queries.forEach((registry, terms) -> {
            RegistryClient client = clients.get(registry);
            if (client == null) {
                log.warn("No registry client configured for {}, skipping {} queries", registry, terms.size());
                return;
            }
            for (String term : terms) {
                tasks.add(new LookupTask(tasks.size(), client, term));
            }
        });
        return tasks;
    }

    @Getter
    @AllArgsConstructor
    private static class LookupTask {
        private final int index;
        private final RegistryClient client;
        private final String query;
    }

    @Getter
    @AllArgsConstructor
    private static class CompletedLookup {
        private final int index;
        private final RegistryLookupResult result;
    }
}
