/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Search criteria. Every filter is optional; unset paging and sort fields fall back to the
 * configured defaults.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PermitSearchRequest {
    private String query;
    private List<String> stateCodes;
    private List<Integer> countyIds;
    private String city;
    private String zipCode;
    private List<Integer> systemTypeIds;
    private LocalDate permitDateFrom;
    private LocalDate permitDateTo;
    private LocalDate installDateFrom;
    private LocalDate installDateTo;
    private Double latitude;
    private Double longitude;
    private Double radiusMiles;
    private Integer page;
    private Integer pageSize;
    private String sortBy;
    private String sortOrder;
    private boolean includeInactive;
}
