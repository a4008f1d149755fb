/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import com.geastalt.permit.entity.DuplicateStatus;

import java.time.Instant;
import java.util.UUID;

public record DuplicateResolutionResponse(
        Long id,
        DuplicateStatus status,
        UUID canonicalId,
        Instant resolvedAt,
        String message) {
}
