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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchHighlighterTest {

    private static final PermitSummary PERMIT = PermitSummary.builder()
            .permitNumber("OSSF-2023-0042")
            .address("123 North Main Street")
            .city("Maine Prairie")
            .ownerName("John SMITH")
            .build();

    @Test
    void highlight_shouldMatchCaseInsensitively() {
        List<SearchHighlight> highlights = SearchHighlighter.highlight(PERMIT, "smith", 20);

        assertEquals(List.of(new SearchHighlight("owner_name", List.of("John SMITH"))), highlights);
    }

    @Test
    void highlight_shouldReportEveryMatchingFieldInDisplayOrder() {
        List<SearchHighlight> highlights = SearchHighlighter.highlight(PERMIT, "  MAIN ", 20);

        assertEquals(List.of("address", "city"), highlights.stream().map(SearchHighlight::field).toList());
        assertEquals(List.of("123 North Main Street"), highlights.get(0).fragments());
    }

    @Test
    void highlight_shouldReturnNothingWithoutQuery() {
        assertTrue(SearchHighlighter.highlight(PERMIT, null, 20).isEmpty());
        assertTrue(SearchHighlighter.highlight(PERMIT, "   ", 20).isEmpty());
    }

    @Test
    void highlight_shouldSkipFieldsWithoutMatch() {
        assertTrue(SearchHighlighter.highlight(PERMIT, "oak", 20).isEmpty());
    }

    @Test
    void fragment_shouldTrimLongValuesWithEllipses() {
        String value = "Lot 7 of the Greenbriar Estates subdivision";

        assertEquals("... the Greenbriar Esta...", SearchHighlighter.fragment(value, "greenbriar", 5));
    }

    @Test
    void fragment_shouldHandleMatchAtEitherEnd() {
        assertEquals("Lot 7...", SearchHighlighter.fragment("Lot 7 of the Greenbriar", "lot", 2));
        assertEquals("...f Greenbriar", SearchHighlighter.fragment("Lot 7 of Greenbriar", "greenbriar", 2));
        assertNull(SearchHighlighter.fragment(null, "lot", 2));
    }

    @Test
    void fragment_shouldKeepOffsetsWhenLowercasingChangesLength() {
        String owner = "İ".repeat(30) + " SMITH";

        assertEquals("..." + "İ".repeat(19) + " SMITH", SearchHighlighter.fragment(owner, "smith", 20));
    }

    @Test
    void highlight_shouldMatchAfterNonAsciiPrefix() {
        PermitSummary permit = PermitSummary.builder().ownerName("İİİ SMITH").build();

        List<SearchHighlight> highlights = SearchHighlighter.highlight(permit, "smith", 20);

        assertEquals(List.of(new SearchHighlight("owner_name", List.of("İİİ SMITH"))), highlights);
    }
}
