/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.controller;

import com.geastalt.permit.dto.PermitDetail;
import com.geastalt.permit.dto.PermitHistory;
import com.geastalt.permit.dto.PermitSearchRequest;
import com.geastalt.permit.dto.PermitSearchResponse;
import com.geastalt.permit.dto.PermitStatsOverview;
import com.geastalt.permit.entity.PermitImportBatch;
import com.geastalt.permit.service.PermitQueryService;
import com.geastalt.permit.service.PermitSearchService;
import com.geastalt.permit.service.PermitStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

@Slf4j
@RestController
@RequestMapping("/api/permits")
@RequiredArgsConstructor
public class PermitController {

    private final PermitSearchService searchService;
    private final PermitQueryService queryService;
    private final PermitStatsService statsService;

    @GetMapping("/search")
    public ResponseEntity<?> search(
            @RequestParam(value = "q", required = false) String query,
            @RequestParam(value = "state_codes", required = false) String stateCodes,
            @RequestParam(value = "county_ids", required = false) String countyIds,
            @RequestParam(value = "city", required = false) String city,
            @RequestParam(value = "zip_code", required = false) String zipCode,
            @RequestParam(value = "system_type_ids", required = false) String systemTypeIds,
            @RequestParam(value = "permit_date_from", required = false) String permitDateFrom,
            @RequestParam(value = "permit_date_to", required = false) String permitDateTo,
            @RequestParam(value = "install_date_from", required = false) String installDateFrom,
            @RequestParam(value = "install_date_to", required = false) String installDateTo,
            @RequestParam(value = "latitude", required = false) Double latitude,
            @RequestParam(value = "longitude", required = false) Double longitude,
            @RequestParam(value = "radius_miles", required = false) Double radiusMiles,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "page_size", required = false) Integer pageSize,
            @RequestParam(value = "sort_by", defaultValue = "relevance") String sortBy,
            @RequestParam(value = "sort_order", defaultValue = "desc") String sortOrder,
            @RequestParam(value = "include_inactive", defaultValue = "false") boolean includeInactive) {

        PermitSearchRequest request;
        try {
            request = PermitSearchRequest.builder()
                    .query(query)
                    .stateCodes(splitList(stateCodes, Function.identity()))
                    .countyIds(splitList(countyIds, Integer::valueOf))
                    .city(city)
                    .zipCode(zipCode)
                    .systemTypeIds(splitList(systemTypeIds, Integer::valueOf))
                    .permitDateFrom(parseDate("permit_date_from", permitDateFrom))
                    .permitDateTo(parseDate("permit_date_to", permitDateTo))
                    .installDateFrom(parseDate("install_date_from", installDateFrom))
                    .installDateTo(parseDate("install_date_to", installDateTo))
                    .latitude(latitude)
                    .longitude(longitude)
                    .radiusMiles(radiusMiles)
                    .page(page)
                    .pageSize(pageSize)
                    .sortBy(sortBy)
                    .sortOrder(sortOrder)
                    .includeInactive(includeInactive)
                    .build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return executeSearch(request);
    }

    @PostMapping("/search")
    public ResponseEntity<?> searchPost(@RequestBody PermitSearchRequest request) {
        return executeSearch(request);
    }

    @GetMapping("/stats/overview")
    public ResponseEntity<PermitStatsOverview> statsOverview() {
        return ResponseEntity.ok(statsService.getOverview());
    }

    @GetMapping("/batches/{batchId}")
    public ResponseEntity<PermitImportBatch> getBatch(@PathVariable UUID batchId) {
        return queryService.getBatch(batchId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{permitId}")
    public ResponseEntity<PermitDetail> getPermit(@PathVariable UUID permitId) {
        return queryService.getPermit(permitId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{permitId}/history")
    public ResponseEntity<PermitHistory> getHistory(@PathVariable UUID permitId) {
        return queryService.getHistory(permitId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private ResponseEntity<?> executeSearch(PermitSearchRequest request) {
        try {
            PermitSearchResponse response = searchService.search(request);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Permit search failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Search failed"));
        }
    }

    static <T> List<T> splitList(String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(part -> !part.isEmpty())
                    .map(parser)
                    .toList();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid list value: " + value, e);
        }
    }

    static LocalDate parseDate(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be an ISO date (yyyy-MM-dd): " + value, e);
        }
    }
}
