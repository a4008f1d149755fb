/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.dto.PermitDetail;
import com.geastalt.permit.dto.PermitHistory;
import com.geastalt.permit.dto.PermitSummary;
import com.geastalt.permit.entity.County;
import com.geastalt.permit.entity.PermitImportBatch;
import com.geastalt.permit.entity.SepticPermit;
import com.geastalt.permit.entity.SepticSystemType;
import com.geastalt.permit.entity.SourcePortal;
import com.geastalt.permit.entity.State;
import com.geastalt.permit.repository.CountyRepository;
import com.geastalt.permit.repository.PermitImportBatchRepository;
import com.geastalt.permit.repository.PermitVersionRepository;
import com.geastalt.permit.repository.SepticPermitRepository;
import com.geastalt.permit.repository.SepticSystemTypeRepository;
import com.geastalt.permit.repository.SourcePortalRepository;
import com.geastalt.permit.repository.StateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entity-shaped reads: permit detail, version history, import batches and permit summaries.
 */
@Service
@RequiredArgsConstructor
public class PermitQueryService {

    private final SepticPermitRepository permitRepository;
    private final PermitVersionRepository versionRepository;
    private final PermitImportBatchRepository batchRepository;
    private final StateRepository stateRepository;
    private final CountyRepository countyRepository;
    private final SepticSystemTypeRepository systemTypeRepository;
    private final SourcePortalRepository sourcePortalRepository;

    @Transactional(readOnly = true)
    public Optional<PermitDetail> getPermit(UUID permitId) {
        return permitRepository.findById(permitId).map(this::toDetail);
    }

    /**
     * The permit's current version and its snapshots, newest first.
     */
    @Transactional(readOnly = true)
    public Optional<PermitHistory> getHistory(UUID permitId) {
        return permitRepository.findById(permitId).map(permit -> new PermitHistory(
                permit.getId(),
                permit.getVersion(),
                versionRepository.findAllByPermitIdOrderByVersionDesc(permitId).stream()
                        .map(version -> new PermitHistory.Entry(
                                version.getVersion(),
                                version.getChangedFields(),
                                version.getChangeSource(),
                                version.getCreatedBy(),
                                version.getCreatedAt(),
                                version.getPermitData()))
                        .toList()));
    }

    @Transactional(readOnly = true)
    public Optional<PermitImportBatch> getBatch(UUID batchId) {
        return batchRepository.findById(batchId);
    }

    /**
     * Summaries for the given permits, keyed by id. Unknown ids are absent from the result.
     */
    @Transactional(readOnly = true)
    public Map<UUID, PermitSummary> getSummaries(Collection<UUID> permitIds) {
        List<SepticPermit> permits = permitRepository.findAllById(permitIds);

        Map<Integer, State> states = byId(stateRepository.findAllById(
                permits.stream().map(SepticPermit::getStateId).filter(Objects::nonNull).collect(Collectors.toSet())),
                State::getId);
        Map<Integer, County> counties = byId(countyRepository.findAllById(
                permits.stream().map(SepticPermit::getCountyId).filter(Objects::nonNull).collect(Collectors.toSet())),
                County::getId);
        Map<Integer, SepticSystemType> systemTypes = byId(systemTypeRepository.findAllById(
                permits.stream().map(SepticPermit::getSystemTypeId).filter(Objects::nonNull).collect(Collectors.toSet())),
                SepticSystemType::getId);

        Map<UUID, PermitSummary> summaries = new HashMap<>();
        for (SepticPermit permit : permits) {
            State state = states.get(permit.getStateId());
            County county = permit.getCountyId() != null ? counties.get(permit.getCountyId()) : null;
            SepticSystemType systemType = permit.getSystemTypeId() != null
                    ? systemTypes.get(permit.getSystemTypeId()) : null;
            summaries.put(permit.getId(), PermitSummary.builder()
                    .id(permit.getId())
                    .permitNumber(permit.getPermitNumber())
                    .address(permit.getAddress())
                    .city(permit.getCity())
                    .zipCode(permit.getZipCode())
                    .stateCode(state != null ? state.getCode() : null)
                    .countyName(county != null ? county.getName() : null)
                    .ownerName(permit.getOwnerName())
                    .permitDate(permit.getPermitDate())
                    .installDate(permit.getInstallDate())
                    .systemType(systemType != null ? systemType.getName() : permit.getSystemTypeRaw())
                    .active(permit.isActive())
                    .hasProperty(permit.getParcelNumber() != null
                            || (permit.getLatitude() != null && permit.getLongitude() != null))
                    .build());
        }
        return summaries;
    }

    private PermitDetail toDetail(SepticPermit permit) {
        Optional<State> state = stateRepository.findById(permit.getStateId());
        Optional<County> county = Optional.ofNullable(permit.getCountyId()).flatMap(countyRepository::findById);
        Optional<SepticSystemType> systemType = Optional.ofNullable(permit.getSystemTypeId())
                .flatMap(systemTypeRepository::findById);
        Optional<SourcePortal> portal = Optional.ofNullable(permit.getSourcePortalId())
                .flatMap(sourcePortalRepository::findById);

        return PermitDetail.builder()
                .id(permit.getId())
                .permitNumber(permit.getPermitNumber())
                .stateId(permit.getStateId())
                .stateCode(state.map(State::getCode).orElse(null))
                .stateName(state.map(State::getName).orElse(null))
                .countyId(permit.getCountyId())
                .countyName(county.map(County::getName).orElse(null))
                .address(permit.getAddress())
                .addressNormalized(permit.getAddressNormalized())
                .city(permit.getCity())
                .zipCode(permit.getZipCode())
                .parcelNumber(permit.getParcelNumber())
                .latitude(permit.getLatitude())
                .longitude(permit.getLongitude())
                .ownerName(permit.getOwnerName())
                .applicantName(permit.getApplicantName())
                .contractorName(permit.getContractorName())
                .installDate(permit.getInstallDate())
                .permitDate(permit.getPermitDate())
                .expirationDate(permit.getExpirationDate())
                .systemTypeId(permit.getSystemTypeId())
                .systemTypeRaw(permit.getSystemTypeRaw())
                .systemTypeName(systemType.map(SepticSystemType::getName).orElse(null))
                .tankSizeGallons(permit.getTankSizeGallons())
                .drainfieldSizeSqft(permit.getDrainfieldSizeSqft())
                .bedrooms(permit.getBedrooms())
                .dailyFlowGpd(permit.getDailyFlowGpd())
                .pdfUrl(permit.getPdfUrl())
                .permitUrl(permit.getPermitUrl())
                .sourcePortalId(permit.getSourcePortalId())
                .sourcePortalCode(permit.getSourcePortalCode())
                .sourcePortalName(portal.map(SourcePortal::getName).orElse(null))
                .scrapedAt(permit.getScrapedAt())
                .active(permit.isActive())
                .duplicateOfId(permit.getDuplicateOfId())
                .dataQualityScore(permit.getDataQualityScore())
                .version(permit.getVersion())
                .createdAt(permit.getCreatedAt())
                .updatedAt(permit.getUpdatedAt())
                .build();
    }

    private static <T> Map<Integer, T> byId(List<T> rows, Function<T, Integer> id) {
        return rows.stream().collect(Collectors.toMap(id, Function.identity()));
    }
}
