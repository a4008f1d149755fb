/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.geastalt.permit.entity.DuplicateStatus;

import java.util.Locale;

/**
 * Reviewer decision on a duplicate pair and the status it leads to.
 */
public enum DuplicateAction {
    MERGE(DuplicateStatus.MERGED),
    REJECT(DuplicateStatus.REJECTED),
    REVIEW(DuplicateStatus.REVIEWED);

    private final DuplicateStatus resultingStatus;

    DuplicateAction(DuplicateStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public DuplicateStatus resultingStatus() {
        return resultingStatus;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DuplicateAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action must be one of merge, reject, review");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Action must be one of merge, reject, review");
        }
    }
}
