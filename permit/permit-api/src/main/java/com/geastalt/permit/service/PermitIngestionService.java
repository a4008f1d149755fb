/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.config.IngestionTransactionConfig;
import com.geastalt.permit.config.PermitIngestionProperties;
import com.geastalt.permit.dto.BatchIngestionRequest;
import com.geastalt.permit.dto.BatchIngestionResponse;
import com.geastalt.permit.dto.BatchIngestionStats;
import com.geastalt.permit.dto.IngestionError;
import com.geastalt.permit.dto.PermitRecord;
import com.geastalt.permit.entity.ImportBatchStatus;
import com.geastalt.permit.entity.PermitImportBatch;
import com.geastalt.permit.repository.ImportBatchStore;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Batch ingestion of scraped permits.
 * <p>
 * Records are processed in order, in chunks that commit every {@code commit-interval} records, so
 * progress survives a later failure. Each record runs under its own savepoint: a record that fails
 * for any reason rolls back alone and is reported in the batch's error details.
 */
@Slf4j
@Service
public class PermitIngestionService {

    private final PermitIngestionEngine ingestionEngine;
    private final ReferenceDataResolver referenceDataResolver;
    private final ImportBatchStore importBatchStore;
    private final PermitEventPublisher eventPublisher;
    private final PermitIngestionProperties ingestionProperties;
    private final TransactionTemplate chunkTransaction;
    private final TransactionTemplate recordTransaction;
    private final Tracer tracer;

    public PermitIngestionService(
            PermitIngestionEngine ingestionEngine,
            ReferenceDataResolver referenceDataResolver,
            ImportBatchStore importBatchStore,
            PermitEventPublisher eventPublisher,
            PermitIngestionProperties ingestionProperties,
            @Qualifier(IngestionTransactionConfig.CHUNK_TEMPLATE) TransactionTemplate chunkTransaction,
            @Qualifier(IngestionTransactionConfig.RECORD_TEMPLATE) TransactionTemplate recordTransaction,
            Tracer tracer) {
        this.ingestionEngine = ingestionEngine;
        this.referenceDataResolver = referenceDataResolver;
        this.importBatchStore = importBatchStore;
        this.eventPublisher = eventPublisher;
        this.ingestionProperties = ingestionProperties;
        this.chunkTransaction = chunkTransaction;
        this.recordTransaction = recordTransaction;
        this.tracer = tracer;
    }

    /**
     * @throws IllegalArgumentException if the request is malformed or exceeds the batch size limit;
     *                                  nothing has been written in that case
     */
    public BatchIngestionResponse ingestBatch(BatchIngestionRequest request) {
        validate(request);
        String portalCode = request.getSourcePortalCode().trim();
        List<PermitRecord> permits = request.getPermits();

        Span span = tracer.spanBuilder("permit.ingestBatch")
                .setAttribute("permit.source_portal", portalCode)
                .setAttribute("permit.batch_size", permits.size())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            BatchIngestionResponse response = runBatch(portalCode, permits);
            BatchIngestionStats stats = response.stats();
            span.setAttribute("permit.inserted", stats.getInserted());
            span.setAttribute("permit.updated", stats.getUpdated());
            span.setAttribute("permit.skipped", stats.getSkipped());
            span.setAttribute("permit.errors", stats.getErrors());
            span.setStatus(StatusCode.OK);
            return response;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private BatchIngestionResponse runBatch(String portalCode, List<PermitRecord> permits) {
        long startNanos = System.nanoTime();
        Instant now = Instant.now();
        ReferenceCache cache = new ReferenceCache();

        PermitImportBatch batch = PermitImportBatch.builder()
                .id(UUID.randomUUID())
                .sourceName(portalCode)
                .totalRecords(permits.size())
                .status(ImportBatchStatus.PROCESSING)
                .startedAt(now)
                .createdAt(now)
                .build();

        Integer portalId = chunkTransaction.execute(status -> {
            int id = referenceDataResolver.resolveSourcePortal(cache, portalCode);
            batch.setSourcePortalId(id);
            importBatchStore.start(batch);
            return id;
        });
        PermitIngestionEngine.SourceContext source = new PermitIngestionEngine.SourceContext(portalId, portalCode, now);

        log.info("Starting batch {}: {} permits from {}", batch.getId(), permits.size(), portalCode);

        BatchTally tally = new BatchTally(ingestionProperties.getMaxErrorDetails());
        int commitInterval = Math.max(1, ingestionProperties.getCommitInterval());
        try {
            for (int from = 0; from < permits.size(); from += commitInterval) {
                int chunkStart = from;
                int chunkEnd = Math.min(from + commitInterval, permits.size());
                List<UUID> touched = chunkTransaction.execute(
                        status -> ingestChunk(permits, chunkStart, chunkEnd, cache, source, tally));
                if (touched != null) {
                    eventPublisher.publishDuplicateCheck(touched);
                }
                log.info("Processed {}/{} permits for batch {}", chunkEnd, permits.size(), batch.getId());
            }
        } catch (RuntimeException e) {
            log.error("Batch {} failed after {} inserted, {} updated", batch.getId(), tally.inserted, tally.updated, e);
            finishBatch(batch, tally, ImportBatchStatus.FAILED, startNanos, portalId);
            throw e;
        }

        ImportBatchStatus finalStatus = tally.errors == 0
                ? ImportBatchStatus.COMPLETED
                : ImportBatchStatus.COMPLETED_WITH_ERRORS;
        double elapsed = finishBatch(batch, tally, finalStatus, startNanos, portalId);

        log.info("Batch {} complete: {} inserted, {} updated, {} skipped, {} errors in {}s",
                batch.getId(), tally.inserted, tally.updated, tally.skipped, tally.errors,
                String.format("%.2f", elapsed));

        BatchIngestionStats stats = BatchIngestionStats.builder()
                .batchId(batch.getId())
                .sourcePortalCode(portalCode)
                .totalRecords(permits.size())
                .inserted(tally.inserted)
                .updated(tally.updated)
                .skipped(tally.skipped)
                .errors(tally.errors)
                .processingTimeSeconds(elapsed)
                .errorDetails(tally.details.isEmpty() ? null : List.copyOf(tally.details))
                .build();
        return new BatchIngestionResponse(finalStatus, stats, "Processed " + permits.size() + " records");
    }

    private List<UUID> ingestChunk(List<PermitRecord> permits, int from, int to, ReferenceCache cache,
                                   PermitIngestionEngine.SourceContext source, BatchTally tally) {
        List<UUID> touched = new ArrayList<>();
        for (int index = from; index < to; index++) {
            PermitRecord record = permits.get(index);
            try {
                IngestOutcome outcome = recordTransaction.execute(status -> {
                    if (record == null) {
                        throw new IllegalArgumentException("Permit record is null");
                    }
                    return ingestionEngine.ingest(record, cache, source);
                });
                cache.confirmCreated();
                tally.count(index, record, outcome, touched);
            } catch (DataIntegrityViolationException e) {
                cache.discardCreated();
                log.warn("Integrity violation ingesting permit {} at index {}: {}",
                        keyOf(record), index, e.getMostSpecificCause().getMessage());
                tally.error(index, record, "Integrity violation: " + e.getMostSpecificCause().getMessage());
            } catch (DataAccessException e) {
                cache.discardCreated();
                log.error("Database error ingesting permit {} at index {}", keyOf(record), index, e);
                tally.error(index, record, "Database error: " + e.getMostSpecificCause().getMessage());
            } catch (RuntimeException e) {
                cache.discardCreated();
                log.error("Error ingesting permit {} at index {}", keyOf(record), index, e);
                tally.error(index, record, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        return touched;
    }

    private double finishBatch(PermitImportBatch batch, BatchTally tally, ImportBatchStatus status,
                               long startNanos, int portalId) {
        double elapsed = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        Instant completedAt = Instant.now();

        batch.setStatus(status);
        batch.setInsertedCount(tally.inserted);
        batch.setUpdatedCount(tally.updated);
        batch.setSkippedCount(tally.skipped);
        batch.setErrorCount(tally.errors);
        batch.setCompletedAt(completedAt);
        batch.setProcessingTimeSeconds(elapsed);
        batch.setErrorDetails(tally.details.stream().map(PermitIngestionService::toMap).toList());

        chunkTransaction.executeWithoutResult(txStatus -> {
            importBatchStore.finish(batch);
            importBatchStore.recordPortalScrape(portalId, completedAt, tally.inserted + tally.updated);
        });
        return elapsed;
    }

    private void validate(BatchIngestionRequest request) {
        if (request == null || request.getPermits() == null) {
            throw new IllegalArgumentException("permits is required");
        }
        if (request.getSourcePortalCode() == null || request.getSourcePortalCode().isBlank()) {
            throw new IllegalArgumentException("source_portal_code is required");
        }
        int maxBatchSize = ingestionProperties.getMaxBatchSize();
        if (request.getPermits().size() > maxBatchSize) {
            throw new IllegalArgumentException("Batch of " + request.getPermits().size()
                    + " permits exceeds the maximum of " + maxBatchSize);
        }
    }

    private static String keyOf(PermitRecord record) {
        if (record == null) {
            return "<null>";
        }
        return record.getPermitNumber() != null ? record.getPermitNumber() : record.getAddress();
    }

    private static Map<String, Object> toMap(IngestionError error) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("index", error.index());
        map.put("permit_number", error.permitNumber());
        map.put("address", error.address());
        map.put("error", error.error());
        return map;
    }

    private static final class BatchTally {
        private final int maxDetails;
        private final List<IngestionError> details = new ArrayList<>();
        private int inserted;
        private int updated;
        private int skipped;
        private int errors;

        BatchTally(int maxDetails) {
            this.maxDetails = maxDetails;
        }

        void count(int index, PermitRecord record, IngestOutcome outcome, List<UUID> touched) {
            if (outcome instanceof IngestOutcome.Inserted insertedOutcome) {
                inserted++;
                touched.add(insertedOutcome.permitId());
            } else if (outcome instanceof IngestOutcome.Updated updatedOutcome) {
                updated++;
                touched.add(updatedOutcome.permitId());
            } else if (outcome instanceof IngestOutcome.Skipped) {
                skipped++;
            } else if (outcome instanceof IngestOutcome.Rejected rejected) {
                error(index, record, rejected.reason());
            }
        }

        void error(int index, PermitRecord record, String message) {
            errors++;
            if (details.size() < maxDetails) {
                details.add(new IngestionError(index,
                        record != null ? record.getPermitNumber() : null,
                        record != null ? record.getAddress() : null,
                        message));
            }
        }
    }
}
