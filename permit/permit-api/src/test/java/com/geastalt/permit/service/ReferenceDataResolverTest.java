/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDataResolverTest {

    private InMemoryReferenceDataStore store;
    private ReferenceDataResolver resolver;
    private ReferenceCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryReferenceDataStore();
        resolver = new ReferenceDataResolver(store);
        cache = new ReferenceCache();
    }

    @Test
    void resolveState_shouldAcceptCodesAndNamesAndCacheLookups() {
        assertEquals(48, resolver.resolveState(cache, "TX"));
        assertEquals(48, resolver.resolveState(cache, "Texas"));
        assertEquals(48, resolver.resolveState(cache, " tx "));

        assertEquals(1, store.stateLookups);
    }

    @Test
    void resolveState_shouldCacheMisses() {
        assertNull(resolver.resolveState(cache, "WY"));
        assertNull(resolver.resolveState(cache, "Wyoming"));

        assertEquals(1, store.stateLookups);
    }

    @Test
    void resolveState_shouldNotLookUpInvalidCodes() {
        assertNull(resolver.resolveState(cache, "ZZ"));
        assertNull(resolver.resolveState(cache, null));

        assertEquals(0, store.stateLookups);
    }

    @Test
    void resolveCounty_shouldCreateOnceForEquivalentNames() {
        int harris = resolver.resolveCounty(cache, 48, "Harris County");

        assertEquals(harris, resolver.resolveCounty(cache, 48, "harris"));
        assertEquals(1, store.countyCreates);
        assertEquals(harris, store.counties.get("48|HARRIS"));
        assertNotEquals(harris, resolver.resolveCounty(cache, 6, "Harris"));
    }

    @Test
    void resolveCounty_shouldReturnNullWithoutCounty() {
        assertNull(resolver.resolveCounty(cache, 48, null));
        assertNull(resolver.resolveCounty(cache, 48, " "));
        assertEquals(0, store.countyCreates);
    }

    @Test
    @DisplayName("A county created by a rolled-back record is forgotten")
    void discardCreated_shouldForgetTentativeCounties() {
        resolver.resolveCounty(cache, 48, "Harris");
        cache.discardCreated();
        store.counties.clear();

        resolver.resolveCounty(cache, 48, "Harris");

        assertEquals(2, store.countyCreates);
    }

    @Test
    void confirmCreated_shouldKeepCountiesCached() {
        int harris = resolver.resolveCounty(cache, 48, "Harris");
        cache.confirmCreated();
        cache.discardCreated();
        store.counties.clear();

        assertEquals(harris, resolver.resolveCounty(cache, 48, "Harris"));
        assertEquals(1, store.countyCreates);
    }

    @ParameterizedTest
    @CsvSource({
            "conventional, 1",
            "ATU, 2",
            "Aerobic, 2",
            "mound system, 3",
            "Drip irrigation, 15"
    })
    void resolveSystemType_shouldMatchCodeThenNameThenUnknown(String raw, int expected) {
        assertEquals(expected, resolver.resolveSystemType(cache, raw));
    }

    @Test
    void resolveSystemType_shouldReturnNullWithoutValue() {
        assertNull(resolver.resolveSystemType(cache, null));
        assertNull(resolver.resolveSystemType(cache, ""));
    }

    @Test
    void resolveSourcePortal_shouldCreateWithDerivedName() {
        int id = resolver.resolveSourcePortal(cache, "travis_county_ossf");

        assertEquals(id, resolver.resolveSourcePortal(cache, "travis_county_ossf"));
        assertEquals("Travis County Ossf", store.portalNames.get("travis_county_ossf"));
        assertEquals(1, store.portals.size());
    }
}
