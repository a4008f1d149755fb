/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.validation;

import com.geastalt.permit.config.PermitSearchProperties;
import com.geastalt.permit.dto.PermitSearchRequest;

import java.time.LocalDate;

/**
 * Validation of search requests. Every failure is an {@link IllegalArgumentException} whose
 * message can be returned to the caller.
 */
public final class PermitSearchRequestValidator {

    private PermitSearchRequestValidator() {
    }

    public static void validate(PermitSearchRequest request, PermitSearchProperties limits) {
        if (request == null) {
            throw new IllegalArgumentException("Search request is required");
        }

        String query = request.getQuery();
        if (query != null && !query.isBlank()) {
            int length = query.trim().length();
            if (length < limits.getMinQueryLength()) {
                throw new IllegalArgumentException(
                        "query must be at least " + limits.getMinQueryLength() + " characters");
            }
            if (length > limits.getMaxQueryLength()) {
                throw new IllegalArgumentException(
                        "query must be at most " + limits.getMaxQueryLength() + " characters");
            }
        }

        if (request.getLatitude() != null && (request.getLatitude() < -90 || request.getLatitude() > 90)) {
            throw new IllegalArgumentException("latitude must be between -90 and 90");
        }
        if (request.getLongitude() != null && (request.getLongitude() < -180 || request.getLongitude() > 180)) {
            throw new IllegalArgumentException("longitude must be between -180 and 180");
        }
        if (request.getRadiusMiles() != null) {
            double radius = request.getRadiusMiles();
            if (radius < limits.getMinRadiusMiles() || radius > limits.getMaxRadiusMiles()) {
                throw new IllegalArgumentException("radius_miles must be between "
                        + limits.getMinRadiusMiles() + " and " + limits.getMaxRadiusMiles());
            }
            if (request.getLatitude() == null || request.getLongitude() == null) {
                throw new IllegalArgumentException("radius_miles requires latitude and longitude");
            }
        }

        if (request.getPage() != null && request.getPage() < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (request.getPageSize() != null
                && (request.getPageSize() < 1 || request.getPageSize() > limits.getMaxPageSize())) {
            throw new IllegalArgumentException("page_size must be between 1 and " + limits.getMaxPageSize());
        }

        String sortOrder = request.getSortOrder();
        if (sortOrder != null && !sortOrder.equalsIgnoreCase("asc") && !sortOrder.equalsIgnoreCase("desc")) {
            throw new IllegalArgumentException("sort_order must be asc or desc");
        }

        checkRange("permit_date", request.getPermitDateFrom(), request.getPermitDateTo());
        checkRange("install_date", request.getInstallDateFrom(), request.getInstallDateTo());
    }

    private static void checkRange(String field, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException(field + "_from must not be after " + field + "_to");
        }
    }
}
