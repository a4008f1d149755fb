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

@Data
@Builder
public class PermitSearchResponse {
    private List<PermitSearchResult> results;
    private long total;
    private int page;
    private int pageSize;
    private int totalPages;
    private String query;
    private double executionTimeMs;
    private List<FacetCount> stateFacets;
    private List<FacetCount> countyFacets;
}
