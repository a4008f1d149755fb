/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.entity.PermitVersion;
import com.geastalt.permit.entity.SepticPermit;

import java.util.Optional;

/**
 * Permit persistence used by ingestion. Implementations must enforce the active-record unique keys
 * on {@code (address_hash, county_id, state_id)} and {@code (permit_number, state_id)} and report a
 * violation as {@link org.springframework.dao.DuplicateKeyException}.
 */
public interface PermitStore {

    Optional<SepticPermit> findActiveByAddressHash(String addressHash, Integer countyId, Integer stateId);

    Optional<SepticPermit> findActiveByPermitNumber(String permitNumber, Integer stateId);

    void insert(SepticPermit permit);

    void update(SepticPermit permit);

    void insertVersion(PermitVersion version);
}
