/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PermitDuplicateTest {

    private static final UUID LOW = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID HIGH = UUID.fromString("ffffffff-0000-0000-0000-000000000001");

    private PermitDuplicate pendingPair() {
        return PermitDuplicate.builder()
                .id(7L)
                .permitId1(LOW)
                .permitId2(HIGH)
                .detectionMethod(DetectionMethod.ADDRESS_HASH)
                .confidenceScore(92.5)
                .build();
    }

    @Test
    @DisplayName("UUID order is unsigned, matching PostgreSQL's uuid comparison")
    void uuidOrderIsUnsigned() {
        // signed comparison puts the high-bit id first
        assertTrue(HIGH.compareTo(LOW) < 0);
        assertTrue(PermitDuplicate.UUID_ORDER.compare(LOW, HIGH) < 0);
        assertTrue(PermitDuplicate.UUID_ORDER.compare(HIGH, LOW) > 0);
        assertEquals(0, PermitDuplicate.UUID_ORDER.compare(LOW, UUID.fromString(LOW.toString())));
    }

    @Test
    void uuidOrderFallsBackToLeastSignificantBits() {
        UUID a = UUID.fromString("12345678-0000-0000-0000-000000000001");
        UUID b = UUID.fromString("12345678-0000-0000-8000-000000000000");

        assertTrue(PermitDuplicate.UUID_ORDER.compare(a, b) < 0);
    }

    @Test
    void newPairIsPending() {
        assertEquals(DuplicateStatus.PENDING, pendingPair().getStatus());
    }

    @Test
    void otherThanReturnsTheOtherMember() {
        PermitDuplicate pair = pendingPair();

        assertEquals(HIGH, pair.otherThan(LOW));
        assertEquals(LOW, pair.otherThan(HIGH));
        assertTrue(pair.involves(LOW));
        assertFalse(pair.involves(UUID.randomUUID()));
    }

    @Test
    void otherThanRejectsOutsider() {
        assertThrows(IllegalArgumentException.class, () -> pendingPair().otherThan(UUID.randomUUID()));
    }

    @Test
    void resolveRecordsTheDecision() {
        PermitDuplicate pair = pendingPair();

        pair.resolve(DuplicateStatus.MERGED, LOW, "reviewer-1", "same lot");

        assertEquals(DuplicateStatus.MERGED, pair.getStatus());
        assertEquals(LOW, pair.getCanonicalId());
        assertEquals("reviewer-1", pair.getResolvedBy());
        assertEquals("same lot", pair.getResolutionNotes());
        assertNotNull(pair.getResolvedAt());
    }

    @Test
    void resolvedPairCannotBeResolvedAgain() {
        PermitDuplicate pair = pendingPair();
        pair.resolve(DuplicateStatus.REJECTED, null, "reviewer-1", null);

        var ex = assertThrows(IllegalStateException.class,
                () -> pair.resolve(DuplicateStatus.MERGED, LOW, "reviewer-2", null));
        assertTrue(ex.getMessage().contains("rejected"));
        assertEquals(DuplicateStatus.REJECTED, pair.getStatus());
    }

    @Test
    void cannotResolveBackToPending() {
        assertThrows(IllegalArgumentException.class,
                () -> pendingPair().resolve(DuplicateStatus.PENDING, null, "reviewer-1", null));
    }

    @Test
    void statusParsesCaseInsensitively() {
        assertEquals(DuplicateStatus.REVIEWED, DuplicateStatus.fromValue(" Reviewed "));
        assertEquals("merged", DuplicateStatus.MERGED.jsonValue());
        assertThrows(IllegalArgumentException.class, () -> DuplicateStatus.fromValue("closed"));
        assertThrows(IllegalArgumentException.class, () -> DuplicateStatus.fromValue(""));
    }
}
