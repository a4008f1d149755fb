/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * One scraped permit as submitted by a scraper. Only {@code stateCode} is required; it may be a
 * two-letter code or a full state name.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PermitRecord {
    private String permitNumber;
    private String stateCode;
    private String countyName;
    private String address;
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
    private String systemType;
    private Integer tankSizeGallons;
    private Integer drainfieldSizeSqft;
    private Integer bedrooms;
    private Integer dailyFlowGpd;
    private String pdfUrl;
    private String permitUrl;
    private Instant scrapedAt;
    private Map<String, Object> rawData;
}
