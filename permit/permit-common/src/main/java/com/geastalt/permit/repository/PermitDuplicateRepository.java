/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.entity.DuplicateStatus;
import com.geastalt.permit.entity.PermitDuplicate;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PermitDuplicateRepository extends JpaRepository<PermitDuplicate, Long> {

    /**
     * Find a pair by its ordered ids.
     */
    Optional<PermitDuplicate> findByPermitId1AndPermitId2(UUID permitId1, UUID permitId2);

    /**
     * Pairs with the given status, highest confidence first.
     */
    List<PermitDuplicate> findByStatusOrderByConfidenceScoreDescIdAsc(DuplicateStatus status, Pageable pageable);
}
