package com.aind.metadata.controller;

import com.aind.metadata.exception.InvalidRecordTypeException;
import com.aind.metadata.exception.RecordNotFoundException;
import com.aind.metadata.model.CaptureRequest;
import com.aind.metadata.model.CaptureResponse;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordLink;
import com.aind.metadata.model.RecordStatus;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.model.ValidationStatus;
import com.aind.metadata.service.CaptureService;
import com.aind.metadata.service.RecordStoreService;
import com.aind.metadata.service.ValidationService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RecordController.class)
class RecordControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecordStoreService storeService;

    @MockBean
    private ValidationService validationService;

    @MockBean
    private CaptureService captureService;

    private static ObjectNode json(String text) throws Exception {
        return (ObjectNode) JsonDocuments.MAPPER.readTree(text);
    }

    @Test
    void recordComesWithItsLinks() throws Exception {
        MetadataRecord subject = MetadataRecord.draft("s1", RecordType.SUBJECT, json("{\"subject_id\": \"4528\"}"), "4528");
        MetadataRecord session = MetadataRecord.draft("s1", RecordType.SESSION, json("{\"rig_id\": \"r1\"}"), null);
        when(storeService.get(subject.getId())).thenReturn(subject);
        when(storeService.linked(subject.getId())).thenReturn(List.of(session));

        mockMvc.perform(get("/records/{id}", subject.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(subject.getId()))
                .andExpect(jsonPath("$.record_type").value("subject"))
                .andExpect(jsonPath("$.category").value("shared"))
                .andExpect(jsonPath("$.status").value("draft"))
                .andExpect(jsonPath("$.data.subject_id").value("4528"))
                .andExpect(jsonPath("$.links[0].id").value(session.getId()))
                .andExpect(jsonPath("$.data_json").doesNotExist());
    }

    @Test
    void missingRecordIs404() throws Exception {
        when(storeService.get("nope")).thenThrow(new RecordNotFoundException("nope"));

        mockMvc.perform(get("/records/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Record not found: nope"));
    }

    @Test
    void unknownTypeFilterIs400() throws Exception {
        mockMvc.perform(get("/records").param("type", "mouse"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_RECORD_TYPE"));

        verifyNoInteractions(storeService);
    }

    @Test
    void listPassesParsedFilters() throws Exception {
        when(storeService.list(RecordType.SUBJECT, null, "s1", RecordStatus.CONFIRMED)).thenReturn(List.of());

        mockMvc.perform(get("/records").param("type", "subject").param("session_id", "s1").param("status", "confirmed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(storeService).list(RecordType.SUBJECT, null, "s1", RecordStatus.CONFIRMED);
    }

    @Test
    void updateRevalidatesAgainstStoredType() throws Exception {
        MetadataRecord record = MetadataRecord.draft("s1", RecordType.SUBJECT, json("{\"subject_id\": \"4528\"}"), null);
        ValidationResult validation = ValidationResult.builder()
                .recordType(RecordType.SUBJECT).status(ValidationStatus.VALID).completenessScore(1.0).build();
        when(storeService.update(eq(record.getId()), any(JsonNode.class), isNull())).thenReturn(record);
        when(validationService.validate(eq(RecordType.SUBJECT), any(JsonNode.class))).thenReturn(validation);
        when(storeService.setValidation(record.getId(), validation)).thenReturn(record);

        mockMvc.perform(put("/records/{id}", record.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\": {\"sex\": \"Male\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(record.getId()));

        verify(storeService).setValidation(record.getId(), validation);
    }

    @Test
    void linkRequiresBothIds() throws Exception {
        mockMvc.perform(post("/records/link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_id\": \"a\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value("target_id is required"));

        verifyNoInteractions(storeService);
    }

    @Test
    void linkReturnsThePair() throws Exception {
        MetadataRecord a = MetadataRecord.draft("s1", RecordType.SUBJECT, json("{\"subject_id\": \"4528\"}"), null);
        MetadataRecord b = MetadataRecord.draft("s1", RecordType.SESSION, json("{\"rig_id\": \"r1\"}"), null);
        when(storeService.link(a.getId(), b.getId())).thenReturn(RecordLink.between(a, b));

        mockMvc.perform(post("/records/link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_id\": \"" + a.getId() + "\", \"target_id\": \"" + b.getId() + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source_id").value(a.getId()))
                .andExpect(jsonPath("$.target_id").value(b.getId()));
    }

    @Test
    void selfLinkIs400() throws Exception {
        when(storeService.link("a", "a")).thenThrow(new IllegalArgumentException("A record cannot be linked to itself: a"));

        mockMvc.perform(post("/records/link")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source_id\": \"a\", \"target_id\": \"a\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void deletingMissingRecordIs404() throws Exception {
        when(storeService.delete("nope")).thenReturn(false);

        mockMvc.perform(delete("/records/{id}", "nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unlinkReportsWhetherAnEdgeWasRemoved() throws Exception {
        when(storeService.unlink("a", "b")).thenReturn(false);

        mockMvc.perform(delete("/records/{id}/links/{otherId}", "a", "b"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not_linked"));
    }

    @Test
    void captureRunsWithoutAChannel() throws Exception {
        when(captureService.capture(any(CaptureRequest.class))).thenReturn(CaptureResponse.builder()
                .action(CaptureResponse.CREATED).recordId("r1").recordType(RecordType.SUBJECT).build());

        mockMvc.perform(post("/records/capture")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"s1\", \"record_type\": \"subject\", \"data\": {\"subject_id\": \"4528\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("created"))
                .andExpect(jsonPath("$.record_type").value("subject"))
                .andExpect(jsonPath("$.registry_lookups").doesNotExist());
    }

    @Test
    void captureWithUnknownTypeIs400() throws Exception {
        when(captureService.capture(any(CaptureRequest.class))).thenThrow(new InvalidRecordTypeException("mouse"));

        mockMvc.perform(post("/records/capture")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"s1\", \"record_type\": \"mouse\", \"data\": {\"a\": 1}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_RECORD_TYPE"));
    }
}
