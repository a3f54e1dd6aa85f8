package com.aind.metadata.service;

import com.aind.metadata.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Hands validation results from capture calls to the stream of the turn they happen in.
 * One instance per turn. Publishing never blocks; a full channel drops the value.
 */
@Slf4j
public class ValidationEventChannel {

    public static final int DEFAULT_CAPACITY = 64;

    private final BlockingQueue<ValidationResult> queue;

    public ValidationEventChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ValidationEventChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public boolean publish(ValidationResult result) {
        boolean accepted = queue.offer(result);
        if (!accepted) {
            log.warn("Validation channel full ({} pending), dropping result for {}",
                    queue.size(), result.getRecordType());
        }
        return accepted;
    }

    /** Next pending result, or null. */
    public ValidationResult poll() {
        return queue.poll();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }
}
