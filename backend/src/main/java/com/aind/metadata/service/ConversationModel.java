package com.aind.metadata.service;

import com.aind.metadata.model.ModelEvent;
import reactor.core.publisher.Flux;

/**
 * The language model that answers a chat turn. Implementations stream their output as
 * {@link ModelEvent}s and call the given tools while the stream is open.
 */
public interface ConversationModel {

    Flux<ModelEvent> respond(String prompt, CaptureTools tools);
}
