/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.controller;

import com.geastalt.permit.dto.BatchIngestionRequest;
import com.geastalt.permit.dto.BatchIngestionResponse;
import com.geastalt.permit.service.PermitIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/permits")
@RequiredArgsConstructor
public class PermitIngestionController {

    private final PermitIngestionService ingestionService;

    @PostMapping("/batch")
    public ResponseEntity<?> ingestBatch(@RequestBody BatchIngestionRequest request) {
        try {
            BatchIngestionResponse response = ingestionService.ingestBatch(request);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected permit batch: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
