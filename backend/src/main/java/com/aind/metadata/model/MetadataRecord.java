package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One typed metadata record. The data payload is kept as JSON text so that free-text
 * search can run against it directly.
 */
@Entity
@Table(name = "metadata_records", indexes = {
    @Index(name = "idx_records_session", columnList = "session_id"),
    @Index(name = "idx_records_type", columnList = "record_type"),
    @Index(name = "idx_records_category", columnList = "category"),
    @Index(name = "idx_records_updated", columnList = "updated_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MetadataRecord {

    static final int MAX_DOCUMENT_LENGTH = 1_048_576;

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @JsonProperty("session_id")
    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @JsonProperty("record_type")
    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, updatable = false, length = 32)
    private RecordType recordType;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, updatable = false, length = 16)
    private RecordCategory category;

    @Setter
    @Column(name = "name")
    private String name;

    @JsonIgnore
    @Column(name = "data_json", nullable = false, length = MAX_DOCUMENT_LENGTH)
    private String dataJson;

    @Setter
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RecordStatus status;

    @JsonIgnore
    @Column(name = "validation_json", length = MAX_DOCUMENT_LENGTH)
    private String validationJson;

    @JsonProperty("created_at")
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Setter
    @JsonProperty("updated_at")
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * New draft record. The category always comes from the record type.
     */
    public static MetadataRecord draft(String sessionId, RecordType recordType, ObjectNode data, String name) {
        MetadataRecord record = new MetadataRecord();
        record.id = UUID.randomUUID().toString();
        record.sessionId = sessionId;
        record.recordType = recordType;
        record.category = recordType.getCategory();
        record.name = name;
        record.setData(data);
        record.status = RecordStatus.DRAFT;
        record.createdAt = LocalDateTime.now();
        record.updatedAt = record.createdAt;
        return record;
    }

    /**
     * A fresh copy of the payload; edits to it do not touch the record.
     */
    @JsonProperty("data")
    public ObjectNode getData() {
        return JsonDocuments.readObject(dataJson);
    }

    public void setData(ObjectNode data) {
        this.dataJson = JsonDocuments.write(data == null ? JsonDocuments.emptyObject() : data);
    }

    @JsonProperty("validation")
    public ValidationResult getValidation() {
        return JsonDocuments.read(validationJson, ValidationResult.class);
    }

    public void setValidation(ValidationResult validation) {
        this.validationJson = validation == null ? null : JsonDocuments.write(validation);
    }

    @Override
    public String toString() {
        return "MetadataRecord{id=" + id + ", type=" + recordType + ", session=" + sessionId
                + ", name=" + name + ", status=" + status + "}";
    }
}
