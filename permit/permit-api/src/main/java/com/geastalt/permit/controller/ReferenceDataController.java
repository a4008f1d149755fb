/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.controller;

import com.geastalt.permit.entity.County;
import com.geastalt.permit.entity.SepticSystemType;
import com.geastalt.permit.entity.SourcePortal;
import com.geastalt.permit.entity.State;
import com.geastalt.permit.normalize.AddressNormalizer;
import com.geastalt.permit.repository.CountyRepository;
import com.geastalt.permit.repository.SepticSystemTypeRepository;
import com.geastalt.permit.repository.SourcePortalRepository;
import com.geastalt.permit.repository.StateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/permits/ref")
@RequiredArgsConstructor
public class ReferenceDataController {

    private final StateRepository stateRepository;
    private final CountyRepository countyRepository;
    private final SepticSystemTypeRepository systemTypeRepository;
    private final SourcePortalRepository sourcePortalRepository;

    @GetMapping("/states")
    public ResponseEntity<List<State>> states() {
        return ResponseEntity.ok(stateRepository.findAllByActiveTrueOrderByName());
    }

    @GetMapping("/counties")
    public ResponseEntity<?> counties(@RequestParam(value = "state_code", required = false) String stateCode) {
        if (stateCode == null || stateCode.isBlank()) {
            return ResponseEntity.ok(countyRepository.findAllByActiveTrueOrderByName());
        }
        String code = AddressNormalizer.normalizeState(stateCode);
        if (code == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown state: " + stateCode));
        }
        Optional<State> state = stateRepository.findByCode(code);
        if (state.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<County> counties = countyRepository.findAllByStateIdAndActiveTrueOrderByName(state.get().getId());
        return ResponseEntity.ok(counties);
    }

    @GetMapping("/system-types")
    public ResponseEntity<List<SepticSystemType>> systemTypes() {
        return ResponseEntity.ok(systemTypeRepository.findAllByActiveTrueOrderByName());
    }

    @GetMapping("/portals")
    public ResponseEntity<List<SourcePortal>> portals() {
        return ResponseEntity.ok(sourcePortalRepository.findAllByActiveTrueOrderByName());
    }
}
