/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.dto.FacetCount;
import com.geastalt.permit.dto.PermitSummary;
import com.geastalt.permit.search.PermitSearchRow;
import com.geastalt.permit.search.PermitSearchSql;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class PermitSearchJdbcRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public List<PermitSearchRow> search(PermitSearchSql sql) {
        return jdbc.query(sql.selectSql(), sql.params(), this::mapRow);
    }

    public long count(PermitSearchSql sql) {
        Long count = jdbc.queryForObject(sql.countSql(), sql.params(), Long.class);
        return count != null ? count : 0;
    }

    public List<FacetCount> stateFacets(PermitSearchSql sql) {
        return jdbc.query(sql.stateFacetSql(), sql.params(), PermitSearchJdbcRepository::mapFacet);
    }

    public List<FacetCount> countyFacets(PermitSearchSql sql) {
        return jdbc.query(sql.countyFacetSql(), sql.params(), PermitSearchJdbcRepository::mapFacet);
    }

    private PermitSearchRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        Double latitude = rs.getObject("latitude", Double.class);
        Double longitude = rs.getObject("longitude", Double.class);
        String parcelNumber = rs.getString("parcel_number");
        String systemTypeName = rs.getString("system_type_name");

        PermitSummary summary = PermitSummary.builder()
                .id(rs.getObject("id", UUID.class))
                .permitNumber(rs.getString("permit_number"))
                .address(rs.getString("address"))
                .city(rs.getString("city"))
                .zipCode(rs.getString("zip_code"))
                .stateCode(rs.getString("state_code"))
                .countyName(rs.getString("county_name"))
                .ownerName(rs.getString("owner_name"))
                .permitDate(rs.getObject("permit_date", LocalDate.class))
                .installDate(rs.getObject("install_date", LocalDate.class))
                .systemType(systemTypeName != null ? systemTypeName : rs.getString("system_type_raw"))
                .active(rs.getBoolean("is_active"))
                .hasProperty(parcelNumber != null || (latitude != null && longitude != null))
                .build();

        return new PermitSearchRow(summary, rs.getObject("keyword_score", Double.class), rs.getDouble("combined_score"));
    }

    private static FacetCount mapFacet(ResultSet rs, int rowNum) throws SQLException {
        return new FacetCount(rs.getString("bucket_key"), rs.getString("bucket_label"), rs.getLong("bucket_count"));
    }
}
