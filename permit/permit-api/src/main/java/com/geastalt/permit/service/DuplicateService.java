/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.dto.DuplicateAction;
import com.geastalt.permit.dto.DuplicateCandidateRequest;
import com.geastalt.permit.dto.DuplicatePair;
import com.geastalt.permit.dto.DuplicateResolutionRequest;
import com.geastalt.permit.dto.DuplicateResolutionResponse;
import com.geastalt.permit.dto.PermitSummary;
import com.geastalt.permit.entity.DuplicateStatus;
import com.geastalt.permit.entity.PermitDuplicate;
import com.geastalt.permit.entity.SepticPermit;
import com.geastalt.permit.repository.PermitDuplicateRepository;
import com.geastalt.permit.repository.SepticPermitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Candidate duplicate pairs and their review.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateService {

    static final int MAX_LIST_LIMIT = 200;
    static final String DEFAULT_RESOLVER = "system";

    private final PermitDuplicateRepository duplicateRepository;
    private final SepticPermitRepository permitRepository;
    private final PermitQueryService permitQueryService;

    /**
     * Records a candidate pair, or returns the existing row if the unordered pair is already known.
     *
     * @throws IllegalArgumentException if the ids are missing, equal or unknown, or the confidence is
     *                                  outside 0-100
     */
    @Transactional
    public PermitDuplicate recordCandidate(DuplicateCandidateRequest request) {
        if (request.getPermitId1() == null || request.getPermitId2() == null) {
            throw new IllegalArgumentException("permit_id_1 and permit_id_2 are required");
        }
        if (request.getPermitId1().equals(request.getPermitId2())) {
            throw new IllegalArgumentException("A permit cannot be a duplicate of itself");
        }
        if (request.getDetectionMethod() == null) {
            throw new IllegalArgumentException("detection_method is required");
        }
        Double confidence = request.getConfidenceScore();
        if (confidence == null || confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence_score must be between 0 and 100");
        }

        UUID first = request.getPermitId1();
        UUID second = request.getPermitId2();
        if (PermitDuplicate.UUID_ORDER.compare(first, second) > 0) {
            first = request.getPermitId2();
            second = request.getPermitId1();
        }

        Optional<PermitDuplicate> existing = duplicateRepository.findByPermitId1AndPermitId2(first, second);
        if (existing.isPresent()) {
            return existing.get();
        }
        for (UUID permitId : List.of(first, second)) {
            if (!permitRepository.existsById(permitId)) {
                throw new IllegalArgumentException("Unknown permit: " + permitId);
            }
        }

        PermitDuplicate duplicate = PermitDuplicate.builder()
                .permitId1(first)
                .permitId2(second)
                .detectionMethod(request.getDetectionMethod())
                .confidenceScore(confidence)
                .matchingFields(request.getMatchingFields() != null ? List.copyOf(request.getMatchingFields()) : List.of())
                .status(DuplicateStatus.PENDING)
                .createdAt(Instant.now())
                .build();
        PermitDuplicate saved = duplicateRepository.save(duplicate);
        log.info("Recorded duplicate candidate {}: {} / {} ({}, confidence {})",
                saved.getId(), first, second, request.getDetectionMethod().jsonValue(), confidence);
        return saved;
    }

    /**
     * Pairs with the given status, highest confidence first, each with summaries of both permits.
     */
    @Transactional(readOnly = true)
    public List<DuplicatePair> listByStatus(DuplicateStatus status, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        List<PermitDuplicate> duplicates = duplicateRepository.findByStatusOrderByConfidenceScoreDescIdAsc(
                status, PageRequest.of(0, limit));

        Set<UUID> permitIds = new LinkedHashSet<>();
        duplicates.forEach(duplicate -> {
            permitIds.add(duplicate.getPermitId1());
            permitIds.add(duplicate.getPermitId2());
        });
        Map<UUID, PermitSummary> summaries = permitQueryService.getSummaries(permitIds);

        return duplicates.stream()
                .map(duplicate -> DuplicatePair.builder()
                        .id(duplicate.getId())
                        .permit1(summaries.get(duplicate.getPermitId1()))
                        .permit2(summaries.get(duplicate.getPermitId2()))
                        .detectionMethod(duplicate.getDetectionMethod())
                        .confidenceScore(duplicate.getConfidenceScore())
                        .matchingFields(duplicate.getMatchingFields())
                        .status(duplicate.getStatus())
                        .createdAt(duplicate.getCreatedAt())
                        .build())
                .toList();
    }

    /**
     * Resolves a pending pair. Merging deactivates the non-canonical permit and points it at the
     * canonical one.
     *
     * @return the resolution, or empty if the pair does not exist
     * @throws IllegalArgumentException if the action is missing, or a merge names no canonical id,
     *                                  a canonical id outside the pair, or an inactive canonical permit
     * @throws IllegalStateException    if the pair is no longer pending
     */
    @Transactional
    public Optional<DuplicateResolutionResponse> resolve(Long duplicateId, DuplicateResolutionRequest request) {
        Optional<PermitDuplicate> found = duplicateRepository.findById(duplicateId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        PermitDuplicate duplicate = found.get();
        DuplicateAction action = request.getAction();
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        String resolver = request.getResolvedBy() != null && !request.getResolvedBy().isBlank()
                ? request.getResolvedBy() : DEFAULT_RESOLVER;

        if (action != DuplicateAction.MERGE) {
            duplicate.resolve(action.resultingStatus(), null, resolver, request.getNotes());
            log.info("Resolved duplicate pair {} as {} by {}", duplicateId, action.jsonValue(), resolver);
            return Optional.of(response(duplicate, "Duplicate pair marked " + duplicate.getStatus().jsonValue()));
        }

        UUID canonicalId = request.getCanonicalId();
        if (canonicalId == null) {
            throw new IllegalArgumentException("canonical_id is required to merge");
        }
        if (!duplicate.involves(canonicalId)) {
            throw new IllegalArgumentException("canonical_id " + canonicalId + " is not part of duplicate pair " + duplicateId);
        }
        SepticPermit canonical = permitRepository.findById(canonicalId)
                .orElseThrow(() -> new IllegalStateException("Permit " + canonicalId + " no longer exists"));
        if (!canonical.isActive()) {
            throw new IllegalArgumentException("Canonical permit " + canonicalId + " is not active");
        }
        UUID duplicateOf = duplicate.otherThan(canonicalId);
        SepticPermit other = permitRepository.findById(duplicateOf)
                .orElseThrow(() -> new IllegalStateException("Permit " + duplicateOf + " no longer exists"));

        duplicate.resolve(DuplicateStatus.MERGED, canonicalId, resolver, request.getNotes());
        other.markDuplicateOf(canonicalId);

        log.info("Merged permit {} into {} (duplicate pair {}) by {}", duplicateOf, canonicalId, duplicateId, resolver);
        return Optional.of(response(duplicate, "Permit " + duplicateOf + " merged into " + canonicalId));
    }

    private static DuplicateResolutionResponse response(PermitDuplicate duplicate, String message) {
        return new DuplicateResolutionResponse(duplicate.getId(), duplicate.getStatus(),
                duplicate.getCanonicalId(), duplicate.getResolvedAt(), message);
    }
}
