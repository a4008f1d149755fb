/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.controller;

import com.geastalt.permit.dto.DuplicateCandidateRequest;
import com.geastalt.permit.dto.DuplicatePair;
import com.geastalt.permit.dto.DuplicateResolutionRequest;
import com.geastalt.permit.entity.DuplicateStatus;
import com.geastalt.permit.entity.PermitDuplicate;
import com.geastalt.permit.service.DuplicateService;
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

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/permits/duplicates")
@RequiredArgsConstructor
public class DuplicateController {

    private final DuplicateService duplicateService;

    @PostMapping
    public ResponseEntity<?> recordCandidate(@RequestBody DuplicateCandidateRequest request) {
        try {
            PermitDuplicate duplicate = duplicateService.recordCandidate(request);
            return ResponseEntity.ok(duplicate);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<?> list(
            @RequestParam(value = "status", defaultValue = "pending") String status,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        try {
            List<DuplicatePair> pairs = duplicateService.listByStatus(DuplicateStatus.fromValue(status), limit);
            return ResponseEntity.ok(pairs);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{duplicateId}/resolve")
    public ResponseEntity<?> resolve(@PathVariable Long duplicateId,
                                     @RequestBody DuplicateResolutionRequest request) {
        try {
            return duplicateService.resolve(duplicateId, request)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }
}
