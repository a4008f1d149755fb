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
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
public class PermitDetail {
    private UUID id;
    private String permitNumber;
    private Integer stateId;
    private String stateCode;
    private String stateName;
    private Integer countyId;
    private String countyName;
    private String address;
    private String addressNormalized;
    private String city;
    private String zipCode;
    private String parcelNumber;
    private Double latitude;
    private Double longitude;
    private String ownerName;
    private String applicantName;
    private String contractorName;
    private LocalDate installDate;
    private LocalDate permitDate;
    private LocalDate expirationDate;
    private Integer systemTypeId;
    private String systemTypeRaw;
    private String systemTypeName;
    private Integer tankSizeGallons;
    private Integer drainfieldSizeSqft;
    private Integer bedrooms;
    private Integer dailyFlowGpd;
    private String pdfUrl;
    private String permitUrl;
    private Integer sourcePortalId;
    private String sourcePortalCode;
    private String sourcePortalName;
    private Instant scrapedAt;
    private boolean active;
    private UUID duplicateOfId;
    private Integer dataQualityScore;
    private int version;
    private Instant createdAt;
    private Instant updatedAt;
}
