/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Search limits and ranking weights.
 */
@Configuration
@ConfigurationProperties(prefix = "permit.search")
@Getter
@Setter
public class PermitSearchProperties {

    private int defaultPageSize = 25;
    private int maxPageSize = 100;

    private double similarityThreshold = 0.1;
    private double keywordWeight = 0.7;
    private double similarityWeight = 0.3;

    private int stateFacetLimit = 20;
    private int countyFacetLimit = 50;

    private int highlightContext = 20;

    private int minQueryLength = 2;
    private int maxQueryLength = 500;

    private double minRadiusMiles = 0.1;
    private double maxRadiusMiles = 100;

    private int statsTopStates = 10;
    private int statsYears = 10;

    /**
     * Resolves a requested page size, using the default when none was given.
     */
    public int resolvePageSize(Integer requested) {
        return requested == null ? defaultPageSize : requested;
    }
}
