/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.config.PermitSearchProperties;
import com.geastalt.permit.dto.FacetCount;
import com.geastalt.permit.dto.PermitSearchRequest;
import com.geastalt.permit.dto.PermitSearchResponse;
import com.geastalt.permit.dto.PermitSearchResult;
import com.geastalt.permit.repository.PermitSearchJdbcRepository;
import com.geastalt.permit.search.PermitSearchRow;
import com.geastalt.permit.search.PermitSearchSql;
import com.geastalt.permit.search.PermitSearchSqlBuilder;
import com.geastalt.permit.validation.PermitSearchRequestValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
public class PermitSearchService {

    private final PermitSearchJdbcRepository searchRepository;
    private final PermitSearchProperties searchProperties;
    private final PermitSearchSqlBuilder sqlBuilder;
    private final Tracer tracer;

    public PermitSearchService(PermitSearchJdbcRepository searchRepository,
                               PermitSearchProperties searchProperties,
                               Tracer tracer) {
        this.searchRepository = searchRepository;
        this.searchProperties = searchProperties;
        this.tracer = tracer;
        this.sqlBuilder = new PermitSearchSqlBuilder(searchProperties.getSimilarityThreshold(),
                searchProperties.getKeywordWeight(), searchProperties.getSimilarityWeight());
    }

    /**
     * @throws IllegalArgumentException if the request fails validation
     */
    @Transactional(readOnly = true)
    public PermitSearchResponse search(PermitSearchRequest request) {
        PermitSearchRequestValidator.validate(request, searchProperties);
        long startNanos = System.nanoTime();

        int page = request.getPage() != null ? request.getPage() : 1;
        int pageSize = searchProperties.resolvePageSize(request.getPageSize());
        boolean stateFiltered = request.getStateCodes() != null && !request.getStateCodes().isEmpty();
        boolean countyFiltered = request.getCountyIds() != null && !request.getCountyIds().isEmpty();

        Span span = tracer.spanBuilder("permit.search")
                .setAttribute("permit.search.page", page)
                .setAttribute("permit.search.page_size", pageSize)
                .setAttribute("permit.search.has_query", request.getQuery() != null && !request.getQuery().isBlank())
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            PermitSearchSql sql = sqlBuilder.build(request, page, pageSize,
                    searchProperties.getStateFacetLimit(), searchProperties.getCountyFacetLimit());

            long total = searchRepository.count(sql);
            List<PermitSearchRow> rows = total == 0 ? List.of() : searchRepository.search(sql);
            String query = sql.hasQuery() ? request.getQuery().trim() : null;

            List<PermitSearchResult> results = rows.stream()
                    .map(row -> PermitSearchResult.builder()
                            .permit(row.summary())
                            .score(row.score())
                            .keywordScore(row.keywordScore())
                            .semanticScore(null)
                            .highlights(SearchHighlighter.highlight(row.summary(), query,
                                    searchProperties.getHighlightContext()))
                            .build())
                    .toList();

            List<FacetCount> stateFacets = stateFiltered ? null : searchRepository.stateFacets(sql);
            List<FacetCount> countyFacets = stateFiltered && !countyFiltered ? searchRepository.countyFacets(sql) : null;

            double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            log.debug("Permit search returned {} of {} results in {}ms", results.size(), total, elapsedMs);

            span.setAttribute("permit.search.total", total);
            span.setStatus(StatusCode.OK);

            return PermitSearchResponse.builder()
                    .results(results)
                    .total(total)
                    .page(page)
                    .pageSize(pageSize)
                    .totalPages(totalPages(total, pageSize))
                    .query(query)
                    .executionTimeMs(elapsedMs)
                    .stateFacets(stateFacets)
                    .countyFacets(countyFacets)
                    .build();
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    static int totalPages(long total, int pageSize) {
        return (int) ((total + pageSize - 1) / pageSize);
    }
}
