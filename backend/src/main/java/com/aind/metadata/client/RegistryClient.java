package com.aind.metadata.client;

import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryLookupResult;
import reactor.core.publisher.Mono;

/**
 * One external registry. Transport and HTTP failures come back as a result carrying
 * {@code error}; anything else may surface as an error signal.
 */
public interface RegistryClient {

    Registry registry();

    Mono<RegistryLookupResult> lookup(String query);
}
