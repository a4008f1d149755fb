/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.config.PermitSqlProperties;
import com.geastalt.permit.dto.PermitStatsOverview;
import com.geastalt.permit.dto.StateStats;
import com.geastalt.permit.dto.YearStats;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class PermitStatsJdbcRepository {

    private final NamedParameterJdbcTemplate jdbc;
    private final PermitSqlProperties sqlProperties;

    public PermitStatsOverview overview(LocalDate today, int topStateLimit, int yearLimit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("monthStart", today.withDayOfMonth(1))
                .addValue("yearStart", today.withDayOfYear(1))
                .addValue("topStateLimit", topStateLimit)
                .addValue("yearLimit", yearLimit);
        PermitSqlProperties.Stats sql = sqlProperties.getStats();

        Map<String, Object> totals = jdbc.queryForMap(sql.getTotals(), params);
        List<StateStats> topStates = jdbc.query(sql.getTopStates(), params, (rs, rowNum) -> new StateStats(
                rs.getString("code"), rs.getString("name"), rs.getLong("total"), rs.getLong("this_year")));
        List<YearStats> byYear = jdbc.query(sql.getByYear(), params, (rs, rowNum) -> new YearStats(
                rs.getInt("year"), rs.getLong("total")));

        Number avgQuality = (Number) totals.get("avg_quality");
        return PermitStatsOverview.builder()
                .totalPermits(count(totals.get("total_permits")))
                .totalStates(count(totals.get("total_states")))
                .totalCounties(count(totals.get("total_counties")))
                .permitsThisMonth(count(totals.get("permits_this_month")))
                .permitsThisYear(count(totals.get("permits_this_year")))
                .avgDataQualityScore(avgQuality != null ? avgQuality.doubleValue() : 0.0)
                .totalSourcePortals(scalar(sql.getActivePortals(), params))
                .duplicatePendingCount(scalar(sql.getPendingDuplicates(), params))
                .topStates(topStates)
                .permitsByYear(byYear)
                .lastUpdated(Instant.now())
                .build();
    }

    private long scalar(String sql, MapSqlParameterSource params) {
        Long value = jdbc.queryForObject(sql, params, Long.class);
        return value != null ? value : 0;
    }

    private static long count(Object value) {
        return value instanceof Number number ? number.longValue() : 0;
    }
}
