/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import com.geastalt.permit.entity.ChangeSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record PermitHistory(UUID permitId, int currentVersion, List<Entry> versions) {

    public record Entry(
            int version,
            List<String> changedFields,
            ChangeSource changeSource,
            String createdBy,
            Instant createdAt,
            Map<String, Object> permitData) {
    }
}
