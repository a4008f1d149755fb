/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.config.PermitSearchProperties;
import com.geastalt.permit.dto.PermitStatsOverview;
import com.geastalt.permit.repository.PermitStatsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class PermitStatsService {

    private final PermitStatsJdbcRepository statsRepository;
    private final PermitSearchProperties searchProperties;
    private final Clock clock = Clock.systemUTC();

    @Transactional(readOnly = true)
    public PermitStatsOverview getOverview() {
        LocalDate today = LocalDate.now(clock);
        PermitStatsOverview overview = statsRepository.overview(today,
                searchProperties.getStatsTopStates(), searchProperties.getStatsYears());
        log.debug("Permit stats: {} active permits in {} states", overview.getTotalPermits(), overview.getTotalStates());
        return overview;
    }
}
