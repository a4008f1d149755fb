/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.controller;

import com.geastalt.permit.dto.DuplicateAction;
import com.geastalt.permit.dto.DuplicateResolutionRequest;
import com.geastalt.permit.entity.DuplicateStatus;
import com.geastalt.permit.service.DuplicateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DuplicateControllerTest {

    @Mock
    private DuplicateService duplicateService;

    private DuplicateController controller;

    private final DuplicateResolutionRequest reject = DuplicateResolutionRequest.builder()
            .action(DuplicateAction.REJECT)
            .build();

    @BeforeEach
    void setUp() {
        controller = new DuplicateController(duplicateService);
    }

    @Test
    void list_shouldParseStatus() {
        when(duplicateService.listByStatus(DuplicateStatus.REVIEWED, 10)).thenReturn(List.of());

        assertEquals(HttpStatus.OK, controller.list("Reviewed", 10).getStatusCode());
    }

    @Test
    void list_shouldRejectUnknownStatus() {
        var result = controller.list("closed", 10);

        assertEquals(HttpStatus.BAD_REQUEST, result.getStatusCode());
        verifyNoInteractions(duplicateService);
    }

    @Test
    void resolve_shouldReturnNotFoundForUnknownPair() {
        when(duplicateService.resolve(eq(7L), any())).thenReturn(Optional.empty());

        assertEquals(HttpStatus.NOT_FOUND, controller.resolve(7L, reject).getStatusCode());
    }

    @Test
    void resolve_shouldReturnConflictForResolvedPair() {
        when(duplicateService.resolve(eq(7L), any()))
                .thenThrow(new IllegalStateException("Duplicate pair 7 is already merged"));

        var result = controller.resolve(7L, reject);

        assertEquals(HttpStatus.CONFLICT, result.getStatusCode());
        assertEquals(Map.of("error", "Duplicate pair 7 is already merged"), result.getBody());
    }

    @Test
    void resolve_shouldReturnBadRequestForInvalidMerge() {
        when(duplicateService.resolve(eq(7L), any()))
                .thenThrow(new IllegalArgumentException("canonical_id is required to merge"));

        assertEquals(HttpStatus.BAD_REQUEST, controller.resolve(7L, reject).getStatusCode());
    }
}
