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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PermitStatsServiceTest {

    @Mock
    private PermitStatsJdbcRepository statsRepository;

    @Test
    void getOverview_shouldPassConfiguredLimitsAndToday() {
        PermitSearchProperties properties = new PermitSearchProperties();
        properties.setStatsTopStates(5);
        properties.setStatsYears(3);
        PermitStatsOverview expected = PermitStatsOverview.builder().totalPermits(42).totalStates(2).build();
        when(statsRepository.overview(any(LocalDate.class), eq(5), eq(3))).thenReturn(expected);

        LocalDate before = LocalDate.now(ZoneOffset.UTC);
        PermitStatsOverview overview = new PermitStatsService(statsRepository, properties).getOverview();
        LocalDate after = LocalDate.now(ZoneOffset.UTC);

        assertSame(expected, overview);
        verify(statsRepository).overview(argThat(today -> !today.isBefore(before) && !today.isAfter(after)), eq(5), eq(3));
    }
}
