/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.search;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Statements for one search request. All of them share {@code params}.
 */
public record PermitSearchSql(
        String selectSql,
        String countSql,
        String stateFacetSql,
        String countyFacetSql,
        boolean hasQuery,
        MapSqlParameterSource params) {
}
