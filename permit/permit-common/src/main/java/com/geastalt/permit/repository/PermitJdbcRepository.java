/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geastalt.permit.config.PermitSqlProperties;
import com.geastalt.permit.entity.PermitVersion;
import com.geastalt.permit.entity.SepticPermit;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC write path for ingestion. Rows are read without {@code raw_data}; the update statement keeps
 * the stored payload when no new one is supplied.
 */
@Repository
@RequiredArgsConstructor
public class PermitJdbcRepository implements PermitStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final PermitSqlProperties sqlProperties;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<SepticPermit> findActiveByAddressHash(String addressHash, Integer countyId, Integer stateId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("addressHash", addressHash)
                .addValue("countyKey", countyId != null ? countyId : 0)
                .addValue("stateId", stateId);
        return first(jdbc.query(sqlProperties.getPermit().getFindActiveByAddressHash(), params, this::mapPermit));
    }

    @Override
    public Optional<SepticPermit> findActiveByPermitNumber(String permitNumber, Integer stateId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("permitNumber", permitNumber)
                .addValue("stateId", stateId);
        return first(jdbc.query(sqlProperties.getPermit().getFindActiveByPermitNumber(), params, this::mapPermit));
    }

    @Override
    public void insert(SepticPermit permit) {
        jdbc.update(sqlProperties.getPermit().getInsert(), permitParams(permit)
                .addValue("createdAt", timestamp(permit.getCreatedAt()), Types.TIMESTAMP));
    }

    @Override
    public void update(SepticPermit permit) {
        jdbc.update(sqlProperties.getPermit().getUpdate(), permitParams(permit));
    }

    @Override
    public void insertVersion(PermitVersion version) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("permitId", version.getPermitId())
                .addValue("version", version.getVersion())
                .addValue("permitData", toJson(version.getPermitData()), Types.VARCHAR)
                .addValue("changedFields", toJson(version.getChangedFields()), Types.VARCHAR)
                .addValue("changeSource", version.getChangeSource().name())
                .addValue("sourcePortalId", version.getSourcePortalId(), Types.INTEGER)
                .addValue("scrapedAt", timestamp(version.getScrapedAt()), Types.TIMESTAMP)
                .addValue("createdAt", timestamp(version.getCreatedAt()), Types.TIMESTAMP)
                .addValue("createdBy", version.getCreatedBy(), Types.VARCHAR);
        jdbc.update(sqlProperties.getPermit().getInsertVersion(), params);
    }

    private MapSqlParameterSource permitParams(SepticPermit permit) {
        return new MapSqlParameterSource()
                .addValue("id", permit.getId())
                .addValue("permitNumber", permit.getPermitNumber(), Types.VARCHAR)
                .addValue("stateId", permit.getStateId())
                .addValue("countyId", permit.getCountyId(), Types.INTEGER)
                .addValue("address", permit.getAddress(), Types.VARCHAR)
                .addValue("addressNormalized", permit.getAddressNormalized(), Types.VARCHAR)
                .addValue("addressHash", permit.getAddressHash(), Types.VARCHAR)
                .addValue("city", permit.getCity(), Types.VARCHAR)
                .addValue("zipCode", permit.getZipCode(), Types.VARCHAR)
                .addValue("parcelNumber", permit.getParcelNumber(), Types.VARCHAR)
                .addValue("latitude", permit.getLatitude(), Types.DOUBLE)
                .addValue("longitude", permit.getLongitude(), Types.DOUBLE)
                .addValue("ownerName", permit.getOwnerName(), Types.VARCHAR)
                .addValue("ownerNameNormalized", permit.getOwnerNameNormalized(), Types.VARCHAR)
                .addValue("applicantName", permit.getApplicantName(), Types.VARCHAR)
                .addValue("contractorName", permit.getContractorName(), Types.VARCHAR)
                .addValue("installDate", permit.getInstallDate(), Types.DATE)
                .addValue("permitDate", permit.getPermitDate(), Types.DATE)
                .addValue("expirationDate", permit.getExpirationDate(), Types.DATE)
                .addValue("systemTypeId", permit.getSystemTypeId(), Types.INTEGER)
                .addValue("systemTypeRaw", permit.getSystemTypeRaw(), Types.VARCHAR)
                .addValue("tankSizeGallons", permit.getTankSizeGallons(), Types.INTEGER)
                .addValue("drainfieldSizeSqft", permit.getDrainfieldSizeSqft(), Types.INTEGER)
                .addValue("bedrooms", permit.getBedrooms(), Types.INTEGER)
                .addValue("dailyFlowGpd", permit.getDailyFlowGpd(), Types.INTEGER)
                .addValue("pdfUrl", permit.getPdfUrl(), Types.VARCHAR)
                .addValue("permitUrl", permit.getPermitUrl(), Types.VARCHAR)
                .addValue("sourcePortalId", permit.getSourcePortalId(), Types.INTEGER)
                .addValue("sourcePortalCode", permit.getSourcePortalCode(), Types.VARCHAR)
                .addValue("scrapedAt", timestamp(permit.getScrapedAt()), Types.TIMESTAMP)
                .addValue("rawData", permit.getRawData() != null ? toJson(permit.getRawData()) : null, Types.VARCHAR)
                .addValue("dataQualityScore", permit.getDataQualityScore(), Types.INTEGER)
                .addValue("version", permit.getVersion())
                .addValue("recordHash", permit.getRecordHash(), Types.VARCHAR)
                .addValue("updatedAt", timestamp(permit.getUpdatedAt()), Types.TIMESTAMP);
    }

    private SepticPermit mapPermit(ResultSet rs, int rowNum) throws SQLException {
        return SepticPermit.builder()
                .id(rs.getObject("id", UUID.class))
                .permitNumber(rs.getString("permit_number"))
                .stateId(rs.getObject("state_id", Integer.class))
                .countyId(rs.getObject("county_id", Integer.class))
                .address(rs.getString("address"))
                .addressNormalized(rs.getString("address_normalized"))
                .addressHash(rs.getString("address_hash"))
                .city(rs.getString("city"))
                .zipCode(rs.getString("zip_code"))
                .parcelNumber(rs.getString("parcel_number"))
                .latitude(rs.getObject("latitude", Double.class))
                .longitude(rs.getObject("longitude", Double.class))
                .ownerName(rs.getString("owner_name"))
                .ownerNameNormalized(rs.getString("owner_name_normalized"))
                .applicantName(rs.getString("applicant_name"))
                .contractorName(rs.getString("contractor_name"))
                .installDate(rs.getObject("install_date", LocalDate.class))
                .permitDate(rs.getObject("permit_date", LocalDate.class))
                .expirationDate(rs.getObject("expiration_date", LocalDate.class))
                .systemTypeId(rs.getObject("system_type_id", Integer.class))
                .systemTypeRaw(rs.getString("system_type_raw"))
                .tankSizeGallons(rs.getObject("tank_size_gallons", Integer.class))
                .drainfieldSizeSqft(rs.getObject("drainfield_size_sqft", Integer.class))
                .bedrooms(rs.getObject("bedrooms", Integer.class))
                .dailyFlowGpd(rs.getObject("daily_flow_gpd", Integer.class))
                .pdfUrl(rs.getString("pdf_url"))
                .permitUrl(rs.getString("permit_url"))
                .sourcePortalId(rs.getObject("source_portal_id", Integer.class))
                .sourcePortalCode(rs.getString("source_portal_code"))
                .scrapedAt(instant(rs.getTimestamp("scraped_at")))
                .active(rs.getBoolean("is_active"))
                .dataQualityScore(rs.getObject("data_quality_score", Integer.class))
                .duplicateOfId(rs.getObject("duplicate_of_id", UUID.class))
                .version(rs.getInt("version"))
                .recordHash(rs.getString("record_hash"))
                .createdAt(instant(rs.getTimestamp("created_at")))
                .updatedAt(instant(rs.getTimestamp("updated_at")))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be stored as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Optional<SepticPermit> first(List<SepticPermit> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
