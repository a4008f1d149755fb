/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class AddressNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "123 North Main Street, Apt. 4B | 123 N MAIN ST APT 4B",
            "456 S.W. Oak Avenue #201       | 456 SW OAK AVE 201",
            "123 N. Main St                 | 123 N MAIN ST",
            "789   east   elm   road        | 789 E ELM RD",
            "100 1st Street                 | 100 1 ST",
            "55 Northwest Highway Suite 3   | 55 NW HWY STE 3"
    })
    void normalizesAddressesToUspsForm(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeAddress(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", ".,#"})
    void unusableAddressNormalizesToNull(String raw) {
        assertNull(AddressNormalizer.normalizeAddress(raw));
    }

    @Test
    @DisplayName("Normalizing an already normalized address changes nothing")
    void normalizationIsIdempotent() {
        String once = AddressNormalizer.normalizeAddress("4410 Southwest Lakeview Parkway, Building 2");
        assertEquals(once, AddressNormalizer.normalizeAddress(once));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "St. Louis County | SAINT LOUIS",
            "harris county    | HARRIS",
            "Anne Arundel     | ANNE ARUNDEL",
            "St Charles       | SAINT CHARLES",
            "Miami-Dade       | MIAMI-DADE"
    })
    void normalizesCountyNames(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeCounty(raw));
    }

    @Test
    void quotesAreDroppedFromAddresses() {
        assertEquals("12 OBRIEN BLVD", AddressNormalizer.normalizeAddress("12 O'Brien Boulevard"));
    }

    @Test
    void blankCountyNormalizesToNull() {
        assertNull(AddressNormalizer.normalizeCounty(null));
        assertNull(AddressNormalizer.normalizeCounty("  "));
    }

    @ParameterizedTest
    @CsvSource({
            "TX, TX",
            "tx, TX",
            "Texas, TX",
            "new york, NY",
            "'  District of Columbia ', DC",
            "Puerto Rico, PR"
    })
    void resolvesStateCodesAndNames(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeState(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"XX", "Texass", "T"})
    void unknownStatesResolveToNull(String raw) {
        assertNull(AddressNormalizer.normalizeState(raw));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "John Smith Jr.        | JOHN SMITH",
            "Acme Septic, LLC      | ACME SEPTIC",
            "Smith Family Trust    | SMITH FAMILY",
            "Dr. Jane (Doe) III    | DR JANE DOE"
    })
    void normalizesOwnerNames(String raw, String expected) {
        assertEquals(expected, AddressNormalizer.normalizeOwnerName(raw));
    }

    @Test
    void ownerNameMadeOnlyOfDesignatorsNormalizesToNull() {
        assertNull(AddressNormalizer.normalizeOwnerName("LLC Inc."));
    }

    @Test
    void addressHashIsSha256OfCompositeKey() {
        String hash = AddressNormalizer.computeAddressHash("123 N MAIN ST", "harris", "tx");

        assertEquals(AddressNormalizer.sha256Hex("123 N MAIN ST|HARRIS|TX"), hash);
        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]{64}"));
    }

    @Test
    void addressHashUsesEmptyComponentsForMissingCountyAndState() {
        assertEquals(AddressNormalizer.sha256Hex("123 N MAIN ST||"),
                AddressNormalizer.computeAddressHash("123 N MAIN ST", null, null));
    }

    @Test
    void addressHashRequiresAnAddress() {
        assertNull(AddressNormalizer.computeAddressHash(null, "HARRIS", "TX"));
        assertNull(AddressNormalizer.computeAddressHash("", "HARRIS", "TX"));
    }

    @Test
    @DisplayName("Differently formatted copies of one address hash identically")
    void equivalentAddressesShareAHash() {
        var first = AddressNormalizer.normalizeAndHash("123 N. Main St", "Harris County", "TX");
        var second = AddressNormalizer.normalizeAndHash("123 North Main Street", "HARRIS", "Texas");

        assertEquals("123 N MAIN ST", first.address());
        assertEquals("HARRIS", first.county());
        assertEquals("TX", first.stateCode());
        assertEquals(first, second);
    }

    @Test
    void differentCountiesProduceDifferentHashes() {
        var harris = AddressNormalizer.normalizeAndHash("123 Main St", "Harris", "TX");
        var travis = AddressNormalizer.normalizeAndHash("123 Main St", "Travis", "TX");

        assertNotEquals(harris.addressHash(), travis.addressHash());
    }
}
