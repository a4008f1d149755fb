/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.config.PermitEventProperties;
import com.geastalt.permit.config.PermitIngestionProperties;
import com.geastalt.permit.dto.BatchIngestionRequest;
import com.geastalt.permit.dto.BatchIngestionResponse;
import com.geastalt.permit.dto.IngestionError;
import com.geastalt.permit.dto.PermitRecord;
import com.geastalt.permit.entity.ImportBatchStatus;
import com.geastalt.permit.entity.PermitImportBatch;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PermitIngestionServiceTest {

    private static final String PORTAL = "harris_epermits";

    private InMemoryPermitStore permitStore;
    private InMemoryReferenceDataStore referenceStore;
    private InMemoryImportBatchStore batchStore;
    private RecordingTransactionManager transactionManager;
    private PermitIngestionProperties ingestionProperties;
    private KafkaTemplate<String, String> kafkaTemplate;
    private PermitIngestionService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        permitStore = new InMemoryPermitStore();
        referenceStore = new InMemoryReferenceDataStore();
        batchStore = new InMemoryImportBatchStore();
        transactionManager = new RecordingTransactionManager();
        ingestionProperties = new PermitIngestionProperties();

        kafkaTemplate = mock(KafkaTemplate.class);
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());

        ReferenceDataResolver resolver = new ReferenceDataResolver(referenceStore);
        TransactionTemplate chunk = new TransactionTemplate(transactionManager);
        chunk.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        chunk.setName("permit-ingestion-chunk");
        TransactionTemplate record = new TransactionTemplate(transactionManager);
        record.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        record.setName("permit-ingestion-record");

        service = new PermitIngestionService(
                new PermitIngestionEngine(permitStore, resolver),
                resolver,
                batchStore,
                new PermitEventPublisher(kafkaTemplate, new PermitEventProperties()),
                ingestionProperties,
                chunk,
                record,
                OpenTelemetry.noop().getTracer("test"));
    }

    private static PermitRecord permit(String number, String address) {
        return PermitRecord.builder()
                .permitNumber(number)
                .stateCode("TX")
                .countyName("Harris")
                .address(address)
                .city("Houston")
                .ownerName("John Smith")
                .systemType("Conventional")
                .build();
    }

    private static BatchIngestionRequest batch(PermitRecord... permits) {
        return new BatchIngestionRequest(PORTAL, Arrays.asList(permits));
    }

    private long begun(String name) {
        return transactionManager.begun.stream().filter(name::equals).count();
    }

    @Test
    @DisplayName("Ingesting the same batch twice inserts once and then skips")
    void reingestIsIdempotent() {
        BatchIngestionResponse first = service.ingestBatch(batch(permit("TX-001", "123 Main St")));
        BatchIngestionResponse second = service.ingestBatch(batch(permit("TX-001", "123 Main St")));

        assertEquals(ImportBatchStatus.COMPLETED, first.status());
        assertEquals(1, first.stats().getInserted());
        assertEquals(0, first.stats().getSkipped());
        assertNull(first.stats().getErrorDetails());
        assertEquals("Processed 1 records", first.message());

        assertEquals(ImportBatchStatus.COMPLETED, second.status());
        assertEquals(0, second.stats().getInserted());
        assertEquals(0, second.stats().getUpdated());
        assertEquals(1, second.stats().getSkipped());
        assertEquals(1, permitStore.permits.size());

        assertEquals(2, batchStore.portalScrapes.size());
        assertEquals(1, batchStore.portalScrapes.get(0).recordCount());
        assertEquals(0, batchStore.portalScrapes.get(1).recordCount());
    }

    @Test
    void batchRowIsStartedAndFinished() {
        BatchIngestionResponse response = service.ingestBatch(batch(
                permit("TX-001", "123 Main St"), permit("TX-002", "9 Elm Rd")));

        assertEquals(1, batchStore.started.size());
        PermitImportBatch stored = batchStore.finished.get(0);
        assertEquals(response.stats().getBatchId(), stored.getId());
        assertEquals(PORTAL, stored.getSourceName());
        assertEquals(referenceStore.portals.get(PORTAL), stored.getSourcePortalId());
        assertEquals(2, stored.getTotalRecords());
        assertEquals(2, stored.getInsertedCount());
        assertEquals(ImportBatchStatus.COMPLETED, stored.getStatus());
        assertNotNull(stored.getCompletedAt());
        assertTrue(stored.getErrorDetails().isEmpty());
        assertEquals("Harris Epermits", referenceStore.portalNames.get(PORTAL));
    }

    @Test
    @DisplayName("A batch over the size limit is rejected before anything is written")
    void oversizedBatchIsRejected() {
        List<PermitRecord> permits = Collections.nCopies(10_001, permit("TX-001", "123 Main St"));

        var e = assertThrows(IllegalArgumentException.class,
                () -> service.ingestBatch(new BatchIngestionRequest(PORTAL, permits)));

        assertTrue(e.getMessage().contains("10000"));
        assertTrue(permitStore.permits.isEmpty());
        assertTrue(batchStore.started.isEmpty());
        assertTrue(transactionManager.begun.isEmpty());
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void missingPortalCodeIsRejected() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> service.ingestBatch(new BatchIngestionRequest("  ", List.of(permit("TX-001", "1 A St")))));

        assertEquals("source_portal_code is required", e.getMessage());
        assertTrue(transactionManager.begun.isEmpty());
    }

    @Test
    void missingPermitListIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.ingestBatch(new BatchIngestionRequest(PORTAL, null)));
    }

    @Test
    void emptyBatchCompletes() {
        BatchIngestionResponse response = service.ingestBatch(batch());

        assertEquals(ImportBatchStatus.COMPLETED, response.status());
        assertEquals(0, response.stats().getTotalRecords());
        assertEquals(1, batchStore.finished.size());
    }

    @Test
    @DisplayName("A failing record is reported and rolled back without affecting its neighbours")
    void failuresAreIsolatedPerRecord() {
        permitStore.racingInsert = p -> "TX-RACE".equals(p.getPermitNumber());
        PermitRecord badState = permit("ZZ-1", "5 Oak Ln").toBuilder().stateCode("ZZ").build();

        BatchIngestionResponse response = service.ingestBatch(batch(
                permit("TX-001", "123 Main St"),
                badState,
                permit("TX-RACE", "77 Race Way"),
                null,
                permit("TX-002", "9 Elm Rd")));

        assertEquals(ImportBatchStatus.COMPLETED_WITH_ERRORS, response.status());
        assertEquals(2, response.stats().getInserted());
        assertEquals(3, response.stats().getErrors());
        assertEquals(2, permitStore.permits.size());

        List<IngestionError> errors = response.stats().getErrorDetails();
        assertEquals(List.of(1, 2, 3), errors.stream().map(IngestionError::index).toList());
        assertEquals("Unknown state: ZZ", errors.get(0).error());
        assertEquals("ZZ-1", errors.get(0).permitNumber());
        assertEquals("5 Oak Ln", errors.get(0).address());
        assertTrue(errors.get(1).error().startsWith("Integrity violation"));
        assertEquals("Permit record is null", errors.get(2).error());
        assertNull(errors.get(2).permitNumber());

        assertEquals(2, transactionManager.rollbacks);

        PermitImportBatch stored = batchStore.finished.get(0);
        assertEquals(ImportBatchStatus.COMPLETED_WITH_ERRORS, stored.getStatus());
        assertEquals(3, stored.getErrorCount());
        assertEquals(1, stored.getErrorDetails().get(0).get("index"));
        assertEquals("Unknown state: ZZ", stored.getErrorDetails().get(0).get("error"));
    }

    @Test
    void errorsBeyondTheDetailLimitAreStillCounted() {
        ingestionProperties.setMaxErrorDetails(2);
        List<PermitRecord> permits = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            permits.add(permit("ZZ-" + i, i + " Oak Ln").toBuilder().stateCode("ZZ").build());
        }

        BatchIngestionResponse response = service.ingestBatch(new BatchIngestionRequest(PORTAL, permits));

        assertEquals(5, response.stats().getErrors());
        assertEquals(2, response.stats().getErrorDetails().size());
    }

    @Test
    @DisplayName("Records commit in chunks and each chunk is announced after it commits")
    void recordsCommitInChunks() {
        ingestionProperties.setCommitInterval(2);

        service.ingestBatch(batch(
                permit("TX-001", "1 A St"),
                permit("TX-002", "2 B St"),
                permit("TX-003", "3 C St"),
                permit("TX-004", "4 D St"),
                permit("TX-005", "5 E St")));

        // batch start, three chunks, batch finish
        assertEquals(5, begun("permit-ingestion-chunk"));
        assertEquals(5, begun("permit-ingestion-record"));
        assertEquals(0, transactionManager.rollbacks);
        for (var id : permitStore.permits.keySet()) {
            verify(kafkaTemplate).send("permit.duplicate-check", id.toString(), id.toString());
        }
    }

    @Test
    void skippedPermitsAreNotAnnounced() {
        service.ingestBatch(batch(permit("TX-001", "123 Main St")));
        clearInvocations(kafkaTemplate);

        service.ingestBatch(batch(permit("TX-001", "123 Main St")));

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void kafkaFailureDoesNotFailTheBatch() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("producer closed"));

        BatchIngestionResponse response = service.ingestBatch(batch(permit("TX-001", "123 Main St")));

        assertEquals(ImportBatchStatus.COMPLETED, response.status());
        assertEquals(1, response.stats().getInserted());
    }

    @Test
    void referenceLookupsAreCachedAcrossTheBatch() {
        service.ingestBatch(batch(
                permit("TX-001", "1 A St"),
                permit("TX-002", "2 B St"),
                permit("TX-003", "3 C St")));

        assertEquals(1, referenceStore.stateLookups);
        assertEquals(1, referenceStore.countyCreates);
    }
}
