package com.aind.metadata.service;

import com.aind.metadata.model.CaptureRequest;
import com.aind.metadata.model.CaptureResponse;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryLookupResult;
import com.aind.metadata.model.ValidationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * One capture: write the record, validate it, persist and publish the validation,
 * then cross-check against external registries on a best-effort basis.
 */
@Service
@Slf4j
public class CaptureService {

    private final RecordStoreService storeService;
    private final ValidationService validationService;
    private final ValidationSummaryFormatter validationFormatter;
    private final RegistryQueryExtractor queryExtractor;
    private final RegistryLookupService lookupService;
    private final RegistrySummaryFormatter registryFormatter;

    public CaptureService(RecordStoreService storeService,
                          ValidationService validationService,
                          ValidationSummaryFormatter validationFormatter,
                          RegistryQueryExtractor queryExtractor,
                          RegistryLookupService lookupService,
                          RegistrySummaryFormatter registryFormatter) {
        this.storeService = storeService;
        this.validationService = validationService;
        this.validationFormatter = validationFormatter;
        this.queryExtractor = queryExtractor;
        this.lookupService = lookupService;
        this.registryFormatter = registryFormatter;
    }

    public CaptureResponse capture(CaptureRequest request) {
        return capture(request, null);
    }

    /**
     * @param channel where the validation is published for the running turn; may be null
     * @throws IllegalArgumentException for a missing session id or non-object data
     * @throws com.aind.metadata.exception.InvalidRecordTypeException before anything is written
     * @throws com.aind.metadata.exception.RecordNotFoundException when {@code record_id} does not exist
     */
    public CaptureResponse capture(CaptureRequest request, ValidationEventChannel channel) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
        RecordType requestedType = RecordType.fromValue(request.getRecordType());
        ObjectNode data = requireObject(request.getData());

        MetadataRecord record;
        String action;
        if (hasText(request.getRecordId())) {
            record = storeService.update(request.getRecordId(), data, request.getName());
            action = CaptureResponse.UPDATED;
            if (record.getRecordType() != requestedType) {
                log.warn("Capture for {} named type {}, validating as stored type {}",
                        record.getId(), requestedType.getValue(), record.getRecordType().getValue());
            }
        } else {
            record = storeService.create(request.getSessionId(), requestedType, data, request.getName());
            action = CaptureResponse.CREATED;
        }
        RecordType recordType = record.getRecordType();
        ObjectNode recordData = record.getData();

        if (hasText(request.getLinkTo())) {
            if (storeService.find(request.getLinkTo()).isPresent()) {
                storeService.link(record.getId(), request.getLinkTo());
            } else {
                log.warn("Link target {} not found, record {} left unlinked", request.getLinkTo(), record.getId());
            }
        }

        ValidationResult validation = validationService.validate(recordType, recordData);
        storeService.setValidation(record.getId(), validation);
        if (channel != null) {
            channel.publish(validation);
        }
        String validationSummary = validationFormatter.format(validation);

        Map<Registry, List<String>> queries = queryExtractor.extractQueries(recordType, recordData);
        List<RegistryLookupResult> registryResults = queries.isEmpty()
                ? List.of()
                : lookupService.runLookups(queries);

        log.info("Capture {} {} record {} (validation={}, registry results={})",
                action, recordType.getValue(), record.getId(), validation.getStatus().getValue(), registryResults.size());

        CaptureResponse.CaptureResponseBuilder response = CaptureResponse.builder()
                .action(action)
                .recordId(record.getId())
                .recordType(recordType)
                .category(record.getCategory())
                .name(record.getName())
                .message("Successfully " + action + " " + recordType.getValue() + " record")
                .validation(validation)
                .validationSummary(validationSummary);
        if (!registryResults.isEmpty()) {
            response.registryLookups(registryResults)
                    .registrySummary(registryFormatter.format(registryResults));
        }
        return response.build();
    }

    /** Accepts a non-empty object, or a string holding one (models sometimes send the data pre-serialized). */
    private static ObjectNode requireObject(JsonNode data) {
        if (data != null && data.isObject() && data.size() > 0) {
            return (ObjectNode) data;
        }
        if (data != null && data.isTextual()) {
            try {
                JsonNode parsed = JsonDocuments.MAPPER.readTree(data.asText());
                if (parsed != null && parsed.isObject() && parsed.size() > 0) {
                    return (ObjectNode) parsed;
                }
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("data must be a JSON object", e);
            }
            throw new IllegalArgumentException("data must be a JSON object");
        }
        throw new IllegalArgumentException("data is required and must be a JSON object");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
