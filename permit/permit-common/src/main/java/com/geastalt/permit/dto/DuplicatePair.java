/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import com.geastalt.permit.entity.DetectionMethod;
import com.geastalt.permit.entity.DuplicateStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class DuplicatePair {
    private Long id;
    private PermitSummary permit1;
    private PermitSummary permit2;
    private DetectionMethod detectionMethod;
    private double confidenceScore;
    private List<String> matchingFields;
    private DuplicateStatus status;
    private Instant createdAt;
}
