/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.entity;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SepticPermitTest {

    @Test
    void newPermitIsActiveAtVersionOne() {
        SepticPermit permit = SepticPermit.builder().id(UUID.randomUUID()).build();

        assertTrue(permit.isActive());
        assertEquals(1, permit.getVersion());
        assertSame(PermitStatus.ACTIVE, permit.getStatus());
    }

    @Test
    void markDuplicateOfDeactivatesAndLinks() {
        UUID canonical = UUID.randomUUID();
        SepticPermit permit = SepticPermit.builder().id(UUID.randomUUID()).build();

        permit.markDuplicateOf(canonical);

        assertFalse(permit.isActive());
        assertEquals(canonical, permit.getDuplicateOfId());
        assertNotNull(permit.getUpdatedAt());
        assertEquals(new PermitStatus.Inactive(PermitStatus.InactiveReason.DUPLICATE, canonical), permit.getStatus());
    }

    @Test
    void permitCannotDuplicateItself() {
        UUID id = UUID.randomUUID();
        SepticPermit permit = SepticPermit.builder().id(id).build();

        assertThrows(IllegalArgumentException.class, () -> permit.markDuplicateOf(id));
        assertThrows(IllegalArgumentException.class, () -> permit.markDuplicateOf(null));
        assertTrue(permit.isActive());
    }

    @Test
    void setStatusWritesBothColumns() {
        UUID canonical = UUID.randomUUID();
        SepticPermit permit = SepticPermit.builder().id(UUID.randomUUID()).build();

        permit.setStatus(new PermitStatus.Inactive(PermitStatus.InactiveReason.DEACTIVATED, null));
        assertFalse(permit.isActive());
        assertNull(permit.getDuplicateOfId());

        permit.setStatus(new PermitStatus.Inactive(PermitStatus.InactiveReason.DUPLICATE, canonical));
        assertFalse(permit.isActive());
        assertEquals(canonical, permit.getDuplicateOfId());

        permit.setStatus(PermitStatus.ACTIVE);
        assertTrue(permit.isActive());
        assertNull(permit.getDuplicateOfId());
        assertSame(PermitStatus.ACTIVE, permit.getStatus());
    }

    @Test
    void inactiveWithoutCanonicalIsDeactivated() {
        PermitStatus status = PermitStatus.of(false, null);

        assertFalse(status.isActive());
        assertEquals(new PermitStatus.Inactive(PermitStatus.InactiveReason.DEACTIVATED, null), status);
    }

    @Test
    void duplicateStatusRequiresCanonical() {
        assertThrows(IllegalArgumentException.class,
                () -> new PermitStatus.Inactive(PermitStatus.InactiveReason.DUPLICATE, null));
    }

    @Test
    void portalNameIsDerivedFromCode() {
        assertEquals("Harris County Epermits", SourcePortal.nameFromCode("harris_county_EPERMITS"));
        assertEquals("Tceq", SourcePortal.nameFromCode("TCEQ"));
    }
}
