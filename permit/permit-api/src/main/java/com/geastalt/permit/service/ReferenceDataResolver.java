/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.entity.SepticSystemType;
import com.geastalt.permit.entity.SourcePortal;
import com.geastalt.permit.normalize.AddressNormalizer;
import com.geastalt.permit.repository.ReferenceDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps free-text state, county, system type and portal values to reference ids.
 * <p>
 * States are a fixed set and are never created. Counties and portals are created on first sight.
 * System types fall back from exact code to name substring to {@code UNKNOWN}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceDataResolver {

    private final ReferenceDataStore referenceDataStore;

    /**
     * @return the state id, or {@code null} when the value is not a known state
     */
    public Integer resolveState(ReferenceCache cache, String rawState) {
        String code = AddressNormalizer.normalizeState(rawState);
        if (code == null) {
            return null;
        }
        if (cache.hasState(code)) {
            return cache.state(code);
        }
        Integer stateId = referenceDataStore.findStateIdByCode(code).orElse(null);
        cache.putState(code, stateId);
        return stateId;
    }

    /**
     * @return the county id, creating the county if needed, or {@code null} when no county was given
     */
    public Integer resolveCounty(ReferenceCache cache, int stateId, String rawCounty) {
        String normalized = AddressNormalizer.normalizeCounty(rawCounty);
        if (normalized == null) {
            return null;
        }
        Integer cached = cache.county(stateId, normalized);
        if (cached != null) {
            return cached;
        }

        Optional<Integer> existing = referenceDataStore.findCountyId(stateId, normalized);
        if (existing.isPresent()) {
            cache.putCounty(stateId, normalized, existing.get(), false);
            return existing.get();
        }

        int countyId = referenceDataStore.createCounty(stateId, rawCounty.trim(), normalized);
        log.info("Created county: stateId={}, name={}, id={}", stateId, normalized, countyId);
        cache.putCounty(stateId, normalized, countyId, true);
        return countyId;
    }

    /**
     * @return the matching system type id, the {@code UNKNOWN} type id when nothing matches, or
     *         {@code null} when no system type was given
     */
    public Integer resolveSystemType(ReferenceCache cache, String rawSystemType) {
        if (rawSystemType == null || rawSystemType.isBlank()) {
            return null;
        }
        String normalized = rawSystemType.trim().toUpperCase(Locale.ROOT);
        if (cache.hasSystemType(normalized)) {
            return cache.systemType(normalized);
        }

        Integer systemTypeId = referenceDataStore.findSystemTypeIdByCode(normalized)
                .or(() -> referenceDataStore.findSystemTypeIdByNameContaining(normalized))
                .or(() -> referenceDataStore.findSystemTypeIdByCode(SepticSystemType.UNKNOWN_CODE))
                .orElse(null);
        cache.putSystemType(normalized, systemTypeId);
        return systemTypeId;
    }

    /**
     * @return the portal id, creating the portal with a name derived from its code if needed
     */
    public int resolveSourcePortal(ReferenceCache cache, String code) {
        Integer cached = cache.portal(code);
        if (cached != null) {
            return cached;
        }
        int portalId = referenceDataStore.findSourcePortalIdByCode(code)
                .orElseGet(() -> {
                    int id = referenceDataStore.createSourcePortal(code, SourcePortal.nameFromCode(code));
                    log.info("Created source portal: code={}, id={}", code, id);
                    return id;
                });
        cache.putPortal(code, portalId);
        return portalId;
    }
}
