/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geastalt.permit.config.PermitSqlProperties;
import com.geastalt.permit.entity.PermitImportBatch;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.Instant;

import static com.geastalt.permit.repository.PermitJdbcRepository.timestamp;

@Repository
@RequiredArgsConstructor
public class ImportBatchJdbcRepository implements ImportBatchStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final PermitSqlProperties sqlProperties;
    private final ObjectMapper objectMapper;

    @Override
    public void start(PermitImportBatch batch) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", batch.getId())
                .addValue("sourcePortalId", batch.getSourcePortalId(), Types.INTEGER)
                .addValue("sourceName", batch.getSourceName())
                .addValue("totalRecords", batch.getTotalRecords())
                .addValue("status", batch.getStatus().name())
                .addValue("startedAt", timestamp(batch.getStartedAt()), Types.TIMESTAMP)
                .addValue("createdAt", timestamp(batch.getCreatedAt()), Types.TIMESTAMP);
        jdbc.update(sqlProperties.getBatch().getInsert(), params);
    }

    @Override
    public void finish(PermitImportBatch batch) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", batch.getId())
                .addValue("insertedCount", batch.getInsertedCount())
                .addValue("updatedCount", batch.getUpdatedCount())
                .addValue("skippedCount", batch.getSkippedCount())
                .addValue("errorCount", batch.getErrorCount())
                .addValue("status", batch.getStatus().name())
                .addValue("completedAt", timestamp(batch.getCompletedAt()), Types.TIMESTAMP)
                .addValue("processingTimeSeconds", batch.getProcessingTimeSeconds(), Types.DOUBLE)
                .addValue("errorDetails", errorDetailsJson(batch), Types.VARCHAR);
        jdbc.update(sqlProperties.getBatch().getFinish(), params);
    }

    @Override
    public void recordPortalScrape(int sourcePortalId, Instant scrapedAt, int recordCount) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", sourcePortalId)
                .addValue("scrapedAt", timestamp(scrapedAt), Types.TIMESTAMP)
                .addValue("recordCount", recordCount);
        jdbc.update(sqlProperties.getBatch().getRecordPortalScrape(), params);
    }

    private String errorDetailsJson(PermitImportBatch batch) {
        if (batch.getErrorDetails() == null || batch.getErrorDetails().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(batch.getErrorDetails());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize error details for batch " + batch.getId(), e);
        }
    }
}
