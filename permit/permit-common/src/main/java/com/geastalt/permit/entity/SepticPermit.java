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
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * One scraped septic permit. The search vector column is maintained by a database trigger and is
 * not mapped.
 */
@Entity
@Table(name = "septic_permits", schema = "public")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SepticPermit {

    @Id
    private UUID id;

    @Column(name = "permit_number", length = 100)
    private String permitNumber;

    @Column(name = "state_id", nullable = false)
    private Integer stateId;

    @Column(name = "county_id")
    private Integer countyId;

    private String address;

    @Column(name = "address_normalized")
    private String addressNormalized;

    @Column(name = "address_hash", length = 64)
    private String addressHash;

    @Column(length = 100)
    private String city;

    @Column(name = "zip_code", length = 10)
    private String zipCode;

    @Column(name = "parcel_number", length = 100)
    private String parcelNumber;

    private Double latitude;

    private Double longitude;

    @Column(name = "owner_name")
    private String ownerName;

    @Column(name = "owner_name_normalized")
    private String ownerNameNormalized;

    @Column(name = "applicant_name")
    private String applicantName;

    @Column(name = "contractor_name")
    private String contractorName;

    @Column(name = "install_date")
    private LocalDate installDate;

    @Column(name = "permit_date")
    private LocalDate permitDate;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Column(name = "system_type_id")
    private Integer systemTypeId;

    @Column(name = "system_type_raw")
    private String systemTypeRaw;

    @Column(name = "tank_size_gallons")
    private Integer tankSizeGallons;

    @Column(name = "drainfield_size_sqft")
    private Integer drainfieldSizeSqft;

    private Integer bedrooms;

    @Column(name = "daily_flow_gpd")
    private Integer dailyFlowGpd;

    @Column(name = "pdf_url")
    private String pdfUrl;

    @Column(name = "permit_url")
    private String permitUrl;

    @Column(name = "source_portal_id")
    private Integer sourcePortalId;

    @Column(name = "source_portal_code", length = 100)
    private String sourcePortalCode;

    @Column(name = "scraped_at")
    private Instant scrapedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_data", columnDefinition = "jsonb")
    private Map<String, Object> rawData;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "data_quality_score")
    private Integer dataQualityScore;

    @Column(name = "duplicate_of_id")
    private UUID duplicateOfId;

    @Builder.Default
    @Column(nullable = false)
    private int version = 1;

    @Column(name = "record_hash", length = 64)
    private String recordHash;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public PermitStatus getStatus() {
        return PermitStatus.of(active, duplicateOfId);
    }

    /**
     * Soft-deactivates this permit in favour of {@code canonicalId}.
     */
    public void markDuplicateOf(UUID canonicalId) {
        if (canonicalId == null || canonicalId.equals(id)) {
            throw new IllegalArgumentException("Canonical permit must be a different permit");
        }
        setStatus(new PermitStatus.Inactive(PermitStatus.InactiveReason.DUPLICATE, canonicalId));
    }

    /**
     * Writes {@code is_active} and {@code duplicate_of_id} from the given status.
     */
    public void setStatus(PermitStatus status) {
        if (status instanceof PermitStatus.Inactive inactive) {
            this.active = false;
            this.duplicateOfId = inactive.canonicalId();
        } else {
            this.active = true;
            this.duplicateOfId = null;
        }
        this.updatedAt = Instant.now();
    }
}
