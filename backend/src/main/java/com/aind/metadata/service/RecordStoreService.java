package com.aind.metadata.service;

import com.aind.metadata.exception.RecordNotFoundException;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordCategory;
import com.aind.metadata.model.RecordLink;
import com.aind.metadata.model.RecordStatus;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.repository.ConversationTurnRepository;
import com.aind.metadata.repository.MetadataRecordRepository;
import com.aind.metadata.repository.RecordLinkRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.aind.metadata.repository.MetadataRecordRepository.hasStatus;
import static com.aind.metadata.repository.MetadataRecordRepository.hasType;
import static com.aind.metadata.repository.MetadataRecordRepository.inCategory;
import static com.aind.metadata.repository.MetadataRecordRepository.inSession;
import static com.aind.metadata.repository.MetadataRecordRepository.mentions;

/**
 * Record lifecycle and the undirected link graph between records.
 * Updates shallow-merge top-level data keys; nothing is versioned.
 */
@Service
@Slf4j
public class RecordStoreService {

    private final MetadataRecordRepository recordRepository;
    private final RecordLinkRepository linkRepository;
    private final ConversationTurnRepository turnRepository;
    private final RecordNameDeriver nameDeriver;
    private final int findLimit;

    public RecordStoreService(MetadataRecordRepository recordRepository,
                              RecordLinkRepository linkRepository,
                              ConversationTurnRepository turnRepository,
                              RecordNameDeriver nameDeriver,
                              @Value("${store.find-limit:50}") int findLimit) {
        this.recordRepository = recordRepository;
        this.linkRepository = linkRepository;
        this.turnRepository = turnRepository;
        this.nameDeriver = nameDeriver;
        this.findLimit = findLimit;
    }

    /**
     * @throws com.aind.metadata.exception.InvalidRecordTypeException before anything is written
     */
    @Transactional
    public MetadataRecord create(String sessionId, String recordType, JsonNode data, String name) {
        return create(sessionId, RecordType.fromValue(recordType), data, name);
    }

    @Transactional
    public MetadataRecord create(String sessionId, RecordType recordType, JsonNode data, String name) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id is required");
        }
        ObjectNode document = asObject(data);
        String resolvedName = hasText(name) ? name : nameDeriver.derive(recordType, document).orElse(null);

        MetadataRecord record = recordRepository.save(MetadataRecord.draft(sessionId, recordType, document, resolvedName));
        log.info("Created {} record {} in session {} (name={})", recordType.getValue(), record.getId(), sessionId, resolvedName);
        return record;
    }

    @Transactional(readOnly = true)
    public Optional<MetadataRecord> find(String id) {
        return id == null ? Optional.empty() : recordRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public MetadataRecord get(String id) {
        return find(id).orElseThrow(() -> new RecordNotFoundException(id));
    }

    /**
     * Shallow-merges {@code data} over the stored data when given. An explicit name wins;
     * otherwise the name is re-derived from the merged data, keeping the old one if nothing derives.
     */
    @Transactional
    public MetadataRecord update(String id, JsonNode data, String name) {
        MetadataRecord record = get(id);

        if (data != null) {
            ObjectNode merged = record.getData();
            merged.setAll(asObject(data));
            record.setData(merged);
        }
        if (hasText(name)) {
            record.setName(name);
        } else if (data != null) {
            nameDeriver.derive(record.getRecordType(), record.getData()).ifPresent(record::setName);
        }
        record.setUpdatedAt(LocalDateTime.now());

        MetadataRecord saved = recordRepository.save(record);
        log.info("Updated {} record {}", saved.getRecordType().getValue(), id);
        return saved;
    }

    /** Attaches a validation result; status is left alone. */
    @Transactional
    public MetadataRecord setValidation(String id, ValidationResult result) {
        MetadataRecord record = get(id);
        record.setValidation(result);
        return recordRepository.save(record);
    }

    @Transactional
    public MetadataRecord confirm(String id) {
        MetadataRecord record = get(id);
        record.setStatus(RecordStatus.CONFIRMED);
        record.setUpdatedAt(LocalDateTime.now());
        log.info("Confirmed {} record {}", record.getRecordType().getValue(), id);
        return recordRepository.save(record);
    }

    @Transactional
    public boolean delete(String id) {
        if (id == null || !recordRepository.existsById(id)) {
            return false;
        }
        int links = linkRepository.deleteIncidentTo(id);
        recordRepository.deleteById(id);
        log.info("Deleted record {} and {} links", id, links);
        return true;
    }

    /**
     * Idempotent in both orientations. Runs outside a service transaction so that a lost
     * insert race on the unique pair can be caught here and treated as success.
     */
    public RecordLink link(String a, String b) {
        MetadataRecord first = get(a);
        MetadataRecord second = get(b);
        if (first.getId().equals(second.getId())) {
            throw new IllegalArgumentException("A record cannot be linked to itself: " + a);
        }
        String low = RecordLink.lowerId(a, b);
        String high = RecordLink.higherId(a, b);

        Optional<RecordLink> existing = linkRepository.findBySourceIdAndTargetId(low, high);
        if (existing.isPresent()) {
            log.debug("Link {} <-> {} already exists", low, high);
            return existing.get();
        }
        try {
            RecordLink link = linkRepository.saveAndFlush(RecordLink.between(first, second));
            log.info("Linked {} <-> {}", low, high);
            return link;
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert of link {} <-> {}, keeping the existing edge", low, high);
            return linkRepository.findBySourceIdAndTargetId(low, high).orElseThrow(() -> e);
        }
    }

    @Transactional
    public boolean unlink(String a, String b) {
        get(a);
        get(b);
        return linkRepository.deletePair(RecordLink.lowerId(a, b), RecordLink.higherId(a, b)) > 0;
    }

    /** Records one edge away from {@code id}, in either orientation. */
    @Transactional(readOnly = true)
    public List<MetadataRecord> linked(String id) {
        get(id);
        Map<String, MetadataRecord> neighbours = new LinkedHashMap<>();
        linkRepository.findTargetsOf(id).forEach(r -> neighbours.putIfAbsent(r.getId(), r));
        linkRepository.findSourcesOf(id).forEach(r -> neighbours.putIfAbsent(r.getId(), r));
        return new ArrayList<>(neighbours.values());
    }

    /**
     * Search across sessions, most recently updated first, capped at the configured limit.
     */
    @Transactional(readOnly = true)
    public List<MetadataRecord> find(RecordType recordType, RecordCategory category, String textQuery) {
        Specification<MetadataRecord> spec = Specification.where(hasType(recordType))
                .and(inCategory(category))
                .and(mentions(textQuery));
        return recordRepository.findAll(spec, PageRequest.of(0, findLimit, Sort.by(Sort.Direction.DESC, "updatedAt")))
                .getContent();
    }

    @Transactional(readOnly = true)
    public List<MetadataRecord> find(String recordType, String category, String textQuery) {
        return find(hasText(recordType) ? RecordType.fromValue(recordType) : null,
                hasText(category) ? RecordCategory.fromValue(category) : null,
                textQuery);
    }

    @Transactional(readOnly = true)
    public List<MetadataRecord> list(RecordType recordType, RecordCategory category, String sessionId, RecordStatus status) {
        Specification<MetadataRecord> spec = Specification.where(hasType(recordType))
                .and(inCategory(category))
                .and(inSession(sessionId))
                .and(hasStatus(status));
        return recordRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    @Transactional(readOnly = true)
    public List<MetadataRecord> listBySession(String sessionId) {
        return recordRepository.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    /**
     * Removes the session's records, their links and the conversation turns.
     *
     * @return false when the session had neither records nor turns
     */
    @Transactional
    public boolean deleteSession(String sessionId) {
        boolean existed = recordRepository.existsBySessionId(sessionId) || turnRepository.existsBySessionId(sessionId);
        if (!existed) {
            return false;
        }
        int links = linkRepository.deleteTouchingSession(sessionId);
        int records = recordRepository.deleteBySessionId(sessionId);
        int turns = turnRepository.deleteBySessionId(sessionId);
        log.info("Deleted session {}: {} records, {} links, {} turns", sessionId, records, links, turns);
        return true;
    }

    private static ObjectNode asObject(JsonNode data) {
        if (data == null || data.isNull()) {
            return JsonDocuments.emptyObject();
        }
        if (!data.isObject()) {
            throw new IllegalArgumentException("data must be a JSON object");
        }
        return (ObjectNode) data;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
