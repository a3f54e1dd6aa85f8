package com.aind.metadata.service;

import com.aind.metadata.exception.RecordNotFoundException;
import com.aind.metadata.model.CaptureRequest;
import com.aind.metadata.model.CaptureResponse;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordLink;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Tools exposed to the conversation model for one turn. Every call returns a JSON string;
 * failures come back as {@code {"status":"error","error":...}} instead of exceptions.
 */
@Slf4j
public class CaptureTools {

    public static final String CAPTURE_METADATA = "capture_metadata";
    public static final String FIND_RECORDS = "find_records";
    public static final String LINK_RECORDS = "link_records";

    private final CaptureService captureService;
    private final RecordStoreService storeService;
    private final ValidationEventChannel channel;

    public CaptureTools(CaptureService captureService, RecordStoreService storeService, ValidationEventChannel channel) {
        this.captureService = captureService;
        this.storeService = storeService;
        this.channel = channel;
    }

    /** Tool names may arrive namespaced, e.g. {@code mcp__capture__capture_metadata}. */
    public static boolean isCaptureTool(String toolName) {
        return toolName != null && toolName.contains(CAPTURE_METADATA);
    }

    public String invoke(String toolName, JsonNode args) {
        if (toolName == null) {
            return error("Unknown tool: null");
        }
        if (toolName.endsWith(CAPTURE_METADATA)) {
            return captureMetadata(args);
        }
        if (toolName.endsWith(FIND_RECORDS)) {
            return findRecords(args);
        }
        if (toolName.endsWith(LINK_RECORDS)) {
            return linkRecords(args);
        }
        return error("Unknown tool: " + toolName);
    }

    public String captureMetadata(JsonNode args) {
        try {
            CaptureRequest request = CaptureRequest.builder()
                    .sessionId(text(args, "session_id"))
                    .recordType(text(args, "record_type"))
                    .data(args == null ? null : args.get("data"))
                    .name(text(args, "name"))
                    .recordId(text(args, "record_id"))
                    .linkTo(text(args, "link_to"))
                    .build();
            CaptureResponse response = captureService.capture(request, channel);
            return JsonDocuments.write(response);
        } catch (IllegalArgumentException | RecordNotFoundException e) {
            log.warn("capture_metadata rejected: {}", e.getMessage());
            return error(e.getMessage());
        } catch (Exception e) {
            log.error("Failed to save record for session {}", text(args, "session_id"), e);
            return error(e.getMessage());
        }
    }

    public String findRecords(JsonNode args) {
        String recordType = text(args, "record_type");
        String query = text(args, "query");
        String category = text(args, "category");
        if (recordType == null && query == null && category == null) {
            return error("At least one of record_type, query, or category is required");
        }
        try {
            List<MetadataRecord> records = storeService.find(recordType, category, query);
            ObjectNode result = JsonDocuments.emptyObject();
            result.put("count", records.size());
            ArrayNode summaries = result.putArray("records");
            for (MetadataRecord record : records) {
                ObjectNode summary = summaries.addObject();
                summary.put("id", record.getId());
                summary.put("record_type", record.getRecordType().getValue());
                summary.put("category", record.getCategory().getValue());
                summary.put("name", record.getName());
                summary.put("status", record.getStatus().getValue());
                summary.set("data", record.getData());
                summary.put("session_id", record.getSessionId());
            }
            return JsonDocuments.write(result);
        } catch (IllegalArgumentException e) {
            return error(e.getMessage());
        } catch (Exception e) {
            log.error("Failed to search records", e);
            return error(e.getMessage());
        }
    }

    public String linkRecords(JsonNode args) {
        String sourceId = text(args, "source_id");
        String targetId = text(args, "target_id");
        if (sourceId == null || targetId == null) {
            return error("Both source_id and target_id are required");
        }
        try {
            MetadataRecord source = storeService.find(sourceId).orElse(null);
            if (source == null) {
                return error("Source record " + sourceId + " not found");
            }
            MetadataRecord target = storeService.find(targetId).orElse(null);
            if (target == null) {
                return error("Target record " + targetId + " not found");
            }
            RecordLink link = storeService.link(sourceId, targetId);

            ObjectNode result = JsonDocuments.emptyObject();
            result.put("message", "Linked " + source.getRecordType().getValue() + " '" + displayName(source)
                    + "' to " + target.getRecordType().getValue() + " '" + displayName(target) + "'");
            result.put("source_id", sourceId);
            result.put("target_id", targetId);
            result.put("link_id", link.getId());
            return JsonDocuments.write(result);
        } catch (IllegalArgumentException | RecordNotFoundException e) {
            return error(e.getMessage());
        } catch (Exception e) {
            log.error("Failed to link records", e);
            return error(e.getMessage());
        }
    }

    static String error(String message) {
        ObjectNode payload = JsonDocuments.emptyObject();
        payload.put("status", "error");
        payload.put("error", message);
        return JsonDocuments.write(payload);
    }

    private static String displayName(MetadataRecord record) {
        return record.getName() != null ? record.getName() : record.getId();
    }

    private static String text(JsonNode args, String field) {
        if (args == null) {
            return null;
        }
        JsonNode node = args.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
