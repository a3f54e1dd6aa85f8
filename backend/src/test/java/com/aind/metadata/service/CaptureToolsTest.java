package com.aind.metadata.service;

import com.aind.metadata.exception.InvalidRecordTypeException;
import com.aind.metadata.model.CaptureRequest;
import com.aind.metadata.model.CaptureResponse;
import com.aind.metadata.model.JsonDocuments;
import com.aind.metadata.model.MetadataRecord;
import com.aind.metadata.model.RecordLink;
import com.aind.metadata.model.RecordType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CaptureToolsTest {

    @Mock
    private CaptureService captureService;

    @Mock
    private RecordStoreService storeService;

    private ValidationEventChannel channel;
    private CaptureTools tools;

    @BeforeEach
    void setUp() {
        channel = new ValidationEventChannel();
        tools = new CaptureTools(captureService, storeService, channel);
    }

    private static JsonNode json(String text) throws Exception {
        return JsonDocuments.MAPPER.readTree(text);
    }

    @Test
    void captureToolNamesMayBeNamespaced() {
        assertThat(CaptureTools.isCaptureTool("capture_metadata")).isTrue();
        assertThat(CaptureTools.isCaptureTool("mcp__capture__capture_metadata")).isTrue();
        assertThat(CaptureTools.isCaptureTool("find_records")).isFalse();
        assertThat(CaptureTools.isCaptureTool(null)).isFalse();
    }

    @Test
    void captureRunsAgainstTheTurnChannel() throws Exception {
        when(captureService.capture(any(CaptureRequest.class), eq(channel))).thenReturn(CaptureResponse.builder()
                .action(CaptureResponse.CREATED).recordId("r1").recordType(RecordType.SUBJECT).build());

        JsonNode result = json(tools.invoke("mcp__capture__capture_metadata", json(
                "{\"session_id\": \"s1\", \"record_type\": \"subject\", \"data\": {\"subject_id\": \"4528\"}, \"link_to\": \"r0\"}")));

        ArgumentCaptor<CaptureRequest> request = ArgumentCaptor.forClass(CaptureRequest.class);
        verify(captureService).capture(request.capture(), eq(channel));
        assertThat(request.getValue().getSessionId()).isEqualTo("s1");
        assertThat(request.getValue().getLinkTo()).isEqualTo("r0");
        assertThat(request.getValue().getData().path("subject_id").asText()).isEqualTo("4528");
        assertThat(result.path("action").asText()).isEqualTo("created");
        assertThat(result.path("record_id").asText()).isEqualTo("r1");
    }

    @Test
    void captureFailuresBecomeErrorPayloads() throws Exception {
        when(captureService.capture(any(CaptureRequest.class), eq(channel)))
                .thenThrow(new InvalidRecordTypeException("mouse"));

        JsonNode result = json(tools.captureMetadata(json("{\"session_id\": \"s1\", \"record_type\": \"mouse\"}")));

        assertThat(result.path("status").asText()).isEqualTo("error");
        assertThat(result.path("error").asText()).contains("mouse");
    }

    @Test
    void unexpectedCaptureFailureIsAlsoReported() throws Exception {
        when(captureService.capture(any(CaptureRequest.class), eq(channel)))
                .thenThrow(new IllegalStateException("database down"));

        JsonNode result = json(tools.captureMetadata(json("{\"session_id\": \"s1\", \"record_type\": \"subject\"}")));

        assertThat(result.path("error").asText()).isEqualTo("database down");
    }

    @Test
    void findNeedsAtLeastOneFilter() throws Exception {
        JsonNode result = json(tools.findRecords(json("{}")));

        assertThat(result.path("status").asText()).isEqualTo("error");
        verifyNoInteractions(storeService);
    }

    @Test
    void findSummarisesMatches() throws Exception {
        MetadataRecord subject = MetadataRecord.draft("s1", RecordType.SUBJECT,
                (ObjectNode) json("{\"subject_id\": \"4528\"}"), "4528");
        when(storeService.find("subject", null, "4528")).thenReturn(List.of(subject));

        JsonNode result = json(tools.invoke(CaptureTools.FIND_RECORDS, json("{\"record_type\": \"subject\", \"query\": \"4528\"}")));

        assertThat(result.path("count").asInt()).isEqualTo(1);
        JsonNode first = result.path("records").get(0);
        assertThat(first.path("id").asText()).isEqualTo(subject.getId());
        assertThat(first.path("category").asText()).isEqualTo("shared");
        assertThat(first.path("status").asText()).isEqualTo("draft");
        assertThat(first.path("data").path("subject_id").asText()).isEqualTo("4528");
    }

    @Test
    void linkReportsMissingRecords() throws Exception {
        when(storeService.find("a")).thenReturn(Optional.empty());

        JsonNode result = json(tools.linkRecords(json("{\"source_id\": \"a\", \"target_id\": \"b\"}")));

        assertThat(result.path("error").asText()).isEqualTo("Source record a not found");
        assertThat(json(tools.linkRecords(json("{\"source_id\": \"a\"}"))).path("error").asText())
                .isEqualTo("Both source_id and target_id are required");
    }

    @Test
    void linkDescribesBothEnds() throws Exception {
        MetadataRecord subject = MetadataRecord.draft("s1", RecordType.SUBJECT, JsonDocuments.emptyObject(), "Mouse A");
        MetadataRecord session = MetadataRecord.draft("s1", RecordType.SESSION, JsonDocuments.emptyObject(), null);
        when(storeService.find(subject.getId())).thenReturn(Optional.of(subject));
        when(storeService.find(session.getId())).thenReturn(Optional.of(session));
        when(storeService.link(subject.getId(), session.getId())).thenReturn(RecordLink.between(subject, session));

        JsonNode result = json(tools.linkRecords(json("{\"source_id\": \"" + subject.getId()
                + "\", \"target_id\": \"" + session.getId() + "\"}")));

        assertThat(result.path("message").asText())
                .isEqualTo("Linked subject 'Mouse A' to session '" + session.getId() + "'");
        assertThat(result.path("source_id").asText()).isEqualTo(subject.getId());
    }

    @Test
    void unknownToolIsAnError() throws Exception {
        JsonNode result = json(tools.invoke("delete_everything", json("{}")));

        assertThat(result.path("error").asText()).isEqualTo("Unknown tool: delete_everything");
    }
}
