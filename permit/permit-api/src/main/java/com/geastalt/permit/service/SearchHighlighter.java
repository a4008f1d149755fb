/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.dto.PermitSummary;
import com.geastalt.permit.dto.SearchHighlight;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Snippets around the first case-insensitive occurrence of the raw query in the displayed
 * fields. Display only; ranking happens in the database.
 */
final class SearchHighlighter {

    static final String ELLIPSIS = "...";

    private SearchHighlighter() {
    }

    static List<SearchHighlight> highlight(PermitSummary permit, String query, int context) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("address", permit.getAddress());
        fields.put("owner_name", permit.getOwnerName());
        fields.put("city", permit.getCity());
        fields.put("permit_number", permit.getPermitNumber());

        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<SearchHighlight> highlights = new ArrayList<>();
        fields.forEach((field, value) -> {
            String fragment = fragment(value, needle, context);
            if (fragment != null) {
                highlights.add(new SearchHighlight(field, List.of(fragment)));
            }
        });
        return highlights;
    }

    static String fragment(String value, String lowerNeedle, int context) {
        if (value == null) {
            return null;
        }
        int index = indexOfIgnoreCase(value, lowerNeedle);
        if (index < 0) {
            return null;
        }
        int start = Math.max(0, index - context);
        int end = Math.min(value.length(), index + lowerNeedle.length() + context);

        StringBuilder fragment = new StringBuilder();
        if (start > 0) {
            fragment.append(ELLIPSIS);
        }
        fragment.append(value, start, end);
        if (end < value.length()) {
            fragment.append(ELLIPSIS);
        }
        return fragment.toString();
    }

    // Offsets stay in the original string; lowercasing can change its length.
    private static int indexOfIgnoreCase(String value, String needle) {
        int last = value.length() - needle.length();
        for (int i = 0; i <= last; i++) {
            if (value.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
