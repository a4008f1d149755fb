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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Candidate duplicate pair awaiting review. {@code permitId1} always sorts before {@code permitId2}
 * in PostgreSQL's uuid order, so each unordered pair has exactly one row.
 */
@Entity
@Table(name = "permit_duplicates", schema = "public", uniqueConstraints = {
        @UniqueConstraint(name = "uq_duplicate_pair", columnNames = {"permit_id_1", "permit_id_2"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PermitDuplicate {

    /**
     * Byte-wise unsigned ordering, which is how PostgreSQL compares uuid values.
     * {@link UUID#compareTo} compares signed longs and disagrees for ids with the high bit set.
     */
    public static final Comparator<UUID> UUID_ORDER = (a, b) -> {
        int cmp = Long.compareUnsigned(a.getMostSignificantBits(), b.getMostSignificantBits());
        return cmp != 0 ? cmp : Long.compareUnsigned(a.getLeastSignificantBits(), b.getLeastSignificantBits());
    };

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "permit_id_1", nullable = false)
    private UUID permitId1;

    @Column(name = "permit_id_2", nullable = false)
    private UUID permitId2;

    @Enumerated(EnumType.STRING)
    @Column(name = "detection_method", nullable = false, length = 50)
    private DetectionMethod detectionMethod;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "matching_fields", columnDefinition = "jsonb")
    private List<String> matchingFields;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DuplicateStatus status = DuplicateStatus.PENDING;

    @Column(name = "canonical_id")
    private UUID canonicalId;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by", length = 100)
    private String resolvedBy;

    @Column(name = "resolution_notes")
    private String resolutionNotes;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean involves(UUID permitId) {
        return permitId1.equals(permitId) || permitId2.equals(permitId);
    }

    /**
     * The member of the pair that is not {@code permitId}.
     */
    public UUID otherThan(UUID permitId) {
        if (permitId1.equals(permitId)) {
            return permitId2;
        }
        if (permitId2.equals(permitId)) {
            return permitId1;
        }
        throw new IllegalArgumentException("Permit " + permitId + " is not part of duplicate pair " + id);
    }

    /**
     * Moves a pending pair to a terminal status.
     *
     * @throws IllegalStateException if the pair has already been resolved
     */
    public void resolve(DuplicateStatus newStatus, UUID canonical, String resolver, String notes) {
        if (status != DuplicateStatus.PENDING) {
            throw new IllegalStateException("Duplicate pair " + id + " is already " + status.jsonValue());
        }
        if (newStatus == DuplicateStatus.PENDING) {
            throw new IllegalArgumentException("Cannot resolve a pair back to pending");
        }
        this.status = newStatus;
        this.canonicalId = canonical;
        this.resolvedBy = resolver;
        this.resolutionNotes = notes;
        this.resolvedAt = Instant.now();
    }
}
