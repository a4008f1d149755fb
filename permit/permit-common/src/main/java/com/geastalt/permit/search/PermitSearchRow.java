/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.search;

import com.geastalt.permit.dto.PermitSummary;

/**
 * A matched permit with its scores. {@code keywordScore} is null when the search had no query.
 */
public record PermitSearchRow(PermitSummary summary, Double keywordScore, double score) {
}
