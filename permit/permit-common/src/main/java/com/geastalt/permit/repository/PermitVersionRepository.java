/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.entity.PermitVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PermitVersionRepository extends JpaRepository<PermitVersion, Long> {

    /**
     * Snapshots of one permit, newest first.
     */
    List<PermitVersion> findAllByPermitIdOrderByVersionDesc(UUID permitId);
}
