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

import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
public class PermitSummary {
    private UUID id;
    private String permitNumber;
    private String address;
    private String city;
    private String zipCode;
    private String stateCode;
    private String countyName;
    private String ownerName;
    private LocalDate permitDate;
    private LocalDate installDate;
    private String systemType;
    private boolean active;
    private boolean hasProperty;
}
