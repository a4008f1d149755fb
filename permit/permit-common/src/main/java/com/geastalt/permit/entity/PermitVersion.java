/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Audit snapshot of a permit as it was before an update. {@code version} is the permit's version
 * at the time the snapshot was taken.
 */
@Entity
@Immutable
@Table(name = "permit_versions", schema = "public", uniqueConstraints = {
        @UniqueConstraint(name = "uq_permit_version", columnNames = {"permit_id", "version"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermitVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "permit_id", nullable = false)
    private UUID permitId;

    @Column(nullable = false)
    private int version;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "permit_data", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> permitData;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "changed_fields", columnDefinition = "jsonb")
    private List<String> changedFields;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_source", nullable = false, length = 50)
    private ChangeSource changeSource;

    @Column(name = "source_portal_id")
    private Integer sourcePortalId;

    @Column(name = "scraped_at")
    private Instant scrapedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;
}
