/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class BatchIngestionStats {
    private UUID batchId;
    private String sourcePortalCode;
    private int totalRecords;
    private int inserted;
    private int updated;
    private int skipped;
    private int errors;
    private double processingTimeSeconds;
    private List<IngestionError> errorDetails;
}
