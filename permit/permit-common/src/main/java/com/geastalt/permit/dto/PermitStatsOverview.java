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

import java.time.Instant;
import java.util.List;

/**
 * Dashboard counters over active permits. Month and year counts are by permit date.
 */
@Data
@Builder
public class PermitStatsOverview {
    private long totalPermits;
    private long totalStates;
    private long totalCounties;
    private long totalSourcePortals;
    private long permitsThisMonth;
    private long permitsThisYear;
    private double avgDataQualityScore;
    private long duplicatePendingCount;
    private List<StateStats> topStates;
    private List<YearStats> permitsByYear;
    private Instant lastUpdated;
}
