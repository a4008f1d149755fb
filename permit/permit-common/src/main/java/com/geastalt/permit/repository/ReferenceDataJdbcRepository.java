/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.config.PermitSqlProperties;
import com.geastalt.permit.search.PermitSearchSqlBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ReferenceDataJdbcRepository implements ReferenceDataStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final PermitSqlProperties sqlProperties;

    @Override
    public Optional<Integer> findStateIdByCode(String code) {
        return queryId(sqlProperties.getReference().getFindStateIdByCode(),
                new MapSqlParameterSource("code", code));
    }

    @Override
    public Optional<Integer> findCountyId(int stateId, String normalizedName) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("stateId", stateId)
                .addValue("normalizedName", normalizedName);
        return queryId(sqlProperties.getReference().getFindCountyId(), params);
    }

    @Override
    public int createCounty(int stateId, String name, String normalizedName) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("stateId", stateId)
                .addValue("name", name)
                .addValue("normalizedName", normalizedName);
        return requireId(jdbc.queryForObject(sqlProperties.getReference().getUpsertCounty(), params, Integer.class));
    }

    @Override
    public Optional<Integer> findSystemTypeIdByCode(String code) {
        return queryId(sqlProperties.getReference().getFindSystemTypeIdByCode(),
                new MapSqlParameterSource("code", code));
    }

    @Override
    public Optional<Integer> findSystemTypeIdByNameContaining(String fragment) {
        return queryId(sqlProperties.getReference().getFindSystemTypeIdByName(),
                new MapSqlParameterSource("pattern", "%" + PermitSearchSqlBuilder.escapeLike(fragment) + "%"));
    }

    @Override
    public Optional<Integer> findSourcePortalIdByCode(String code) {
        return queryId(sqlProperties.getReference().getFindSourcePortalIdByCode(),
                new MapSqlParameterSource("code", code));
    }

    @Override
    public int createSourcePortal(String code, String name) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("code", code)
                .addValue("name", name);
        return requireId(jdbc.queryForObject(sqlProperties.getReference().getUpsertSourcePortal(), params, Integer.class));
    }

    private Optional<Integer> queryId(String sql, MapSqlParameterSource params) {
        List<Integer> ids = jdbc.queryForList(sql, params, Integer.class);
        return ids.isEmpty() ? Optional.empty() : Optional.ofNullable(ids.get(0));
    }

    private static int requireId(Integer id) {
        if (id == null) {
            throw new IllegalStateException("Upsert did not return an id");
        }
        return id;
    }
}
