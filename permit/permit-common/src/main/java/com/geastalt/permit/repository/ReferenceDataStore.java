/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import java.util.Optional;

/**
 * Lookups and get-or-create writes for reference rows.
 */
public interface ReferenceDataStore {

    Optional<Integer> findStateIdByCode(String code);

    Optional<Integer> findCountyId(int stateId, String normalizedName);

    /**
     * Returns the id of the county keyed by {@code (stateId, normalizedName)}, inserting it with
     * {@code name} if it does not exist yet.
     */
    int createCounty(int stateId, String name, String normalizedName);

    Optional<Integer> findSystemTypeIdByCode(String code);

    /**
     * First system type whose name contains {@code fragment}, ignoring case.
     */
    Optional<Integer> findSystemTypeIdByNameContaining(String fragment);

    Optional<Integer> findSourcePortalIdByCode(String code);

    int createSourcePortal(String code, String name);
}
