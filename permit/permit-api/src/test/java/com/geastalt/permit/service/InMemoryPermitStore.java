/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.entity.PermitVersion;
import com.geastalt.permit.entity.SepticPermit;
import com.geastalt.permit.repository.PermitStore;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Permit store that enforces the same active-record unique keys as the partial indexes.
 */
class InMemoryPermitStore implements PermitStore {

    final Map<UUID, SepticPermit> permits = new LinkedHashMap<>();
    final List<PermitVersion> versions = new ArrayList<>();

    /**
     * Inserts matching this predicate fail as if a concurrent batch had won the race.
     */
    Predicate<SepticPermit> racingInsert = permit -> false;

    @Override
    public Optional<SepticPermit> findActiveByAddressHash(String addressHash, Integer countyId, Integer stateId) {
        return permits.values().stream()
                .filter(SepticPermit::isActive)
                .filter(p -> addressHash.equals(p.getAddressHash()))
                .filter(p -> Objects.equals(countyId, p.getCountyId()))
                .filter(p -> stateId.equals(p.getStateId()))
                .findFirst()
                .map(p -> p.toBuilder().build());
    }

    @Override
    public Optional<SepticPermit> findActiveByPermitNumber(String permitNumber, Integer stateId) {
        return permits.values().stream()
                .filter(SepticPermit::isActive)
                .filter(p -> permitNumber.equals(p.getPermitNumber()))
                .filter(p -> stateId.equals(p.getStateId()))
                .findFirst()
                .map(p -> p.toBuilder().build());
    }

    @Override
    public void insert(SepticPermit permit) {
        if (racingInsert.test(permit)) {
            throw new DuplicateKeyException("duplicate key value violates unique constraint \"idx_septic_permits_dedup_address\"");
        }
        checkUnique(permit);
        permits.put(permit.getId(), permit.toBuilder().build());
    }

    @Override
    public void update(SepticPermit permit) {
        if (!permits.containsKey(permit.getId())) {
            throw new IllegalStateException("No permit " + permit.getId());
        }
        checkUnique(permit);
        permits.put(permit.getId(), permit.toBuilder().build());
    }

    @Override
    public void insertVersion(PermitVersion version) {
        boolean exists = versions.stream().anyMatch(v ->
                v.getPermitId().equals(version.getPermitId()) && v.getVersion() == version.getVersion());
        if (exists) {
            throw new DuplicateKeyException("duplicate key value violates unique constraint \"uq_permit_version\"");
        }
        versions.add(version);
    }

    SepticPermit only() {
        if (permits.size() != 1) {
            throw new IllegalStateException("Expected one permit but found " + permits.size());
        }
        return permits.values().iterator().next();
    }

    private void checkUnique(SepticPermit candidate) {
        for (SepticPermit other : permits.values()) {
            if (!other.isActive() || other.getId().equals(candidate.getId())) {
                continue;
            }
            boolean sameLocation = candidate.getAddressHash() != null
                    && candidate.getAddressHash().equals(other.getAddressHash())
                    && Objects.equals(candidate.getCountyId(), other.getCountyId())
                    && candidate.getStateId().equals(other.getStateId());
            boolean sameNumber = candidate.getPermitNumber() != null
                    && candidate.getPermitNumber().equals(other.getPermitNumber())
                    && candidate.getStateId().equals(other.getStateId());
            if (sameLocation || sameNumber) {
                throw new DuplicateKeyException("duplicate key value violates unique constraint on permit " + other.getId());
            }
        }
    }
}
