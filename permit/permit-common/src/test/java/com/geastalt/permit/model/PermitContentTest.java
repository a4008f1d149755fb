/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.model;

import com.geastalt.permit.dto.PermitRecord;
import com.geastalt.permit.entity.SepticPermit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PermitContentTest {

    private static PermitRecord.PermitRecordBuilder baseRecord() {
        return PermitRecord.builder()
                .permitNumber("TX-001")
                .stateCode("TX")
                .countyName("Harris")
                .address("123 Main St")
                .city("Houston")
                .zipCode("77002")
                .ownerName("John Smith")
                .permitDate(LocalDate.of(2023, 5, 1))
                .systemType("Conventional")
                .tankSizeGallons(1000);
    }

    @Test
    void fingerprintIsStableForEqualContent() {
        var first = PermitContent.of(baseRecord().build());
        var second = PermitContent.of(baseRecord().build());

        assertEquals(first.fingerprint(), second.fingerprint());
        assertEquals(64, first.fingerprint().length());
    }

    @Test
    void fingerprintChangesWhenAnyContentFieldChanges() {
        var original = PermitContent.of(baseRecord().build());
        var changed = PermitContent.of(baseRecord().bedrooms(3).build());

        assertNotEquals(original.fingerprint(), changed.fingerprint());
    }

    @Test
    @DisplayName("Scrape time, raw payload and location references are not part of the fingerprint")
    void fingerprintIgnoresNonContentFields() {
        var first = PermitContent.of(baseRecord()
                .scrapedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .rawData(Map.of("page", 1))
                .build());
        var second = PermitContent.of(baseRecord()
                .scrapedAt(Instant.parse("2024-06-01T00:00:00Z"))
                .rawData(Map.of("page", 7))
                .countyName("Travis")
                .build());

        assertEquals(first.fingerprint(), second.fingerprint());
    }

    @Test
    void overlayKeepsExistingValuesWhenIncomingIsNull() {
        var current = PermitContent.of(baseRecord().build());
        var incoming = PermitContent.of(PermitRecord.builder()
                .stateCode("TX")
                .ownerName("Jane Smith")
                .build());

        var merged = current.overlay(incoming);

        assertEquals("Jane Smith", merged.ownerName());
        assertEquals("TX-001", merged.permitNumber());
        assertEquals("123 Main St", merged.address());
        assertEquals(1000, merged.tankSizeGallons());
        assertEquals(LocalDate.of(2023, 5, 1), merged.permitDate());
    }

    @Test
    void changedFieldsListsOnlyNonNullDifferences() {
        var current = PermitContent.of(baseRecord().build());
        var incoming = PermitContent.of(PermitRecord.builder()
                .permitNumber("TX-001")
                .ownerName("Jane Smith")
                .bedrooms(4)
                .build());

        assertEquals(List.of("owner_name", "bedrooms"), current.changedFields(incoming));
    }

    @Test
    void changedFieldsIsEmptyForIdenticalContent() {
        var current = PermitContent.of(baseRecord().build());

        assertTrue(current.changedFields(PermitContent.of(baseRecord().build())).isEmpty());
    }

    @Test
    @DisplayName("A partial re-scrape with unchanged values merges back to the stored fingerprint")
    void mergingUnchangedSubsetKeepsFingerprint() {
        var current = PermitContent.of(baseRecord().build());
        var partial = PermitContent.of(PermitRecord.builder()
                .permitNumber("TX-001")
                .city("Houston")
                .build());

        assertEquals(current.fingerprint(), current.overlay(partial).fingerprint());
        assertTrue(current.changedFields(partial).isEmpty());
    }

    @Test
    void toMapUsesCanonicalFieldOrderAndIsoDates() {
        Map<String, Object> values = PermitContent.of(baseRecord().build()).toMap();

        List<String> expectedKeys = Arrays.stream(PermitField.values()).map(PermitField::columnName).toList();
        assertEquals(expectedKeys, List.copyOf(values.keySet()));
        assertEquals("2023-05-01", values.get("permit_date"));
        assertEquals("Conventional", values.get("system_type_raw"));
        assertNull(values.get("install_date"));
    }

    @Test
    void completenessIsShareOfPopulatedFields() {
        var empty = PermitContent.of(PermitRecord.builder().stateCode("TX").build());
        var partial = PermitContent.of(baseRecord().build());

        assertEquals(0, empty.completeness());
        // 8 of 20 content fields
        assertEquals(40, partial.completeness());
    }

    @Test
    void applyToWritesEveryFieldIncludingNulls() {
        SepticPermit permit = SepticPermit.builder()
                .permitNumber("OLD")
                .bedrooms(2)
                .build();

        PermitContent.of(baseRecord().build()).applyTo(permit);

        assertEquals("TX-001", permit.getPermitNumber());
        assertEquals("Conventional", permit.getSystemTypeRaw());
        assertNull(permit.getBedrooms());
        assertEquals(PermitContent.of(baseRecord().build()), PermitContent.of(permit));
    }
}
