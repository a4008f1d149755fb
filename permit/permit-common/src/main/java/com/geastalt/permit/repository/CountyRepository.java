/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.entity.County;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CountyRepository extends JpaRepository<County, Integer> {

    List<County> findAllByActiveTrueOrderByName();

    /**
     * Active counties of one state, by name.
     */
    List<County> findAllByStateIdAndActiveTrueOrderByName(Integer stateId);
}
