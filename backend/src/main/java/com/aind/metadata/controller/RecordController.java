package com.aind.metadata.controller;

import com.aind.metadata.exception.RecordNotFoundException;
import com.aind.metadata.model.CaptureRequest;
import com.aind.metadata.model.CaptureResponse;
import com.aind.metadata.model.LinkRequest;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordCategory;
import com.aind.metadata.model.RecordDetail;
import com.aind.metadata.model.RecordLink;
import com.aind.metadata.model.RecordStatus;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.UpdateRecordRequest;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.service.CaptureService;
import com.aind.metadata.service.RecordStoreService;
import com.aind.metadata.service.ValidationService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/records")
@CrossOrigin(origins = "*")
@Slf4j
public class RecordController {

    private final RecordStoreService storeService;
    private final ValidationService validationService;
    private final CaptureService captureService;

    public RecordController(RecordStoreService storeService,
                            ValidationService validationService,
                            CaptureService captureService) {
        this.storeService = storeService;
        this.validationService = validationService;
        this.captureService = captureService;
    }

    /**
     * List records, newest first. All filters are optional.
     */
    @GetMapping
    public ResponseEntity<List<MetadataRecord>> listRecords(
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "session_id", required = false) String sessionId,
            @RequestParam(name = "status", required = false) String status) {
        List<MetadataRecord> records = storeService.list(
                isSet(type) ? RecordType.fromValue(type) : null,
                isSet(category) ? RecordCategory.fromValue(category) : null,
                isSet(sessionId) ? sessionId : null,
                isSet(status) ? RecordStatus.fromValue(status) : null);
        return ResponseEntity.ok(records);
    }

    /**
     * Text search over names and data, most recently updated first.
     */
    @GetMapping("/search")
    public ResponseEntity<List<MetadataRecord>> searchRecords(
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "q", required = false) String query) {
        return ResponseEntity.ok(storeService.find(type, category, query));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RecordDetail> getRecord(@PathVariable("id") String id) {
        MetadataRecord record = storeService.get(id);
        return ResponseEntity.ok(new RecordDetail(record, storeService.linked(id)));
    }

    /**
     * Merge new data into the record and re-validate it against its stored type.
     */
    @PutMapping("/{id}")
    public ResponseEntity<MetadataRecord> updateRecord(@PathVariable("id") String id,
                                                       @RequestBody UpdateRecordRequest request) {
        MetadataRecord updated = storeService.update(id, request.getData(), request.getName());
        ValidationResult validation = validationService.validate(updated.getRecordType(), updated.getData());
        return ResponseEntity.ok(storeService.setValidation(id, validation));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<MetadataRecord> confirmRecord(@PathVariable("id") String id) {
        return ResponseEntity.ok(storeService.confirm(id));
    }

    @GetMapping("/{id}/links")
    public ResponseEntity<List<MetadataRecord>> getLinks(@PathVariable("id") String id) {
        return ResponseEntity.ok(storeService.linked(id));
    }

    @PostMapping("/link")
    public ResponseEntity<Map<String, Object>> linkRecords(@Valid @RequestBody LinkRequest request) {
        RecordLink link = storeService.link(request.getSourceId(), request.getTargetId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("link_id", link.getId());
        body.put("source_id", request.getSourceId());
        body.put("target_id", request.getTargetId());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{id}/links/{otherId}")
    public ResponseEntity<Map<String, Object>> unlinkRecords(@PathVariable("id") String id,
                                                             @PathVariable("otherId") String otherId) {
        boolean removed = storeService.unlink(id, otherId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", removed ? "unlinked" : "not_linked");
        body.put("source_id", id);
        body.put("target_id", otherId);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteRecord(@PathVariable("id") String id) {
        if (!storeService.delete(id)) {
            throw new RecordNotFoundException(id);
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "record_id", id));
    }

    /**
     * Capture outside a chat turn. No validation event is streamed.
     */
    @PostMapping("/capture")
    public ResponseEntity<CaptureResponse> capture(@RequestBody CaptureRequest request) {
        log.info("Capture request: session={}, type={}, record_id={}",
                request.getSessionId(), request.getRecordType(), request.getRecordId());
        return ResponseEntity.ok(captureService.capture(request));
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
