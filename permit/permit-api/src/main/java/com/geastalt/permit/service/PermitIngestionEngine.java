/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.dto.PermitRecord;
import com.geastalt.permit.entity.ChangeSource;
import com.geastalt.permit.entity.PermitVersion;
import com.geastalt.permit.entity.SepticPermit;
import com.geastalt.permit.model.PermitContent;
import com.geastalt.permit.normalize.AddressNormalizer;
import com.geastalt.permit.repository.PermitStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ingests a single scraped record: resolve references, normalize, find the existing permit for
 * the same location or permit number, then insert, skip or update it.
 * <p>
 * Runs inside the caller's transaction and does no error handling of its own; any exception
 * means the record must be rolled back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermitIngestionEngine {

    static final String SYSTEM_USER = "system";

    private final PermitStore permitStore;
    private final ReferenceDataResolver referenceDataResolver;

    public IngestOutcome ingest(PermitRecord record, ReferenceCache cache, SourceContext source) {
        Integer stateId = referenceDataResolver.resolveState(cache, record.getStateCode());
        if (stateId == null) {
            log.warn("Unknown state code: {} (permit {})", record.getStateCode(), record.getPermitNumber());
            return new IngestOutcome.Rejected("Unknown state: " + record.getStateCode());
        }
        String stateCode = AddressNormalizer.normalizeState(record.getStateCode());
        Integer countyId = referenceDataResolver.resolveCounty(cache, stateId, record.getCountyName());

        AddressNormalizer.NormalizedLocation location =
                AddressNormalizer.normalizeAndHash(record.getAddress(), record.getCountyName(), stateCode);
        PermitContent incoming = PermitContent.of(record);
        Instant scrapedAt = record.getScrapedAt() != null ? record.getScrapedAt() : source.now();

        Optional<SepticPermit> match = findMatch(location.addressHash(), record.getPermitNumber(), countyId, stateId);
        if (match.isEmpty()) {
            return insert(record, incoming, location, stateId, countyId, scrapedAt, cache, source);
        }

        SepticPermit existing = match.get();
        PermitContent current = PermitContent.of(existing);
        PermitContent merged = current.overlay(incoming);
        String mergedHash = merged.fingerprint();
        if (mergedHash.equals(existing.getRecordHash())) {
            return new IngestOutcome.Skipped(existing.getId());
        }

        List<String> changedFields = current.changedFields(incoming);
        permitStore.insertVersion(snapshot(existing, current, changedFields, scrapedAt, source));

        merged.applyTo(existing);
        if (location.addressHash() != null) {
            existing.setAddressNormalized(location.address());
            existing.setAddressHash(location.addressHash());
        }
        if (countyId != null) {
            existing.setCountyId(countyId);
        }
        if (record.getSystemType() != null) {
            existing.setSystemTypeId(referenceDataResolver.resolveSystemType(cache, record.getSystemType()));
        }
        existing.setOwnerNameNormalized(AddressNormalizer.normalizeOwnerName(merged.ownerName()));
        existing.setSourcePortalId(source.portalId());
        existing.setSourcePortalCode(source.portalCode());
        existing.setScrapedAt(scrapedAt);
        existing.setRawData(record.getRawData());
        existing.setDataQualityScore(merged.completeness());
        existing.setVersion(existing.getVersion() + 1);
        existing.setRecordHash(mergedHash);
        existing.setUpdatedAt(source.now());
        permitStore.update(existing);

        log.debug("Updated permit {} to version {}: {}", existing.getId(), existing.getVersion(), changedFields);
        return new IngestOutcome.Updated(existing.getId(), existing.getVersion(), changedFields);
    }

    private Optional<SepticPermit> findMatch(String addressHash, String permitNumber, Integer countyId, Integer stateId) {
        Optional<SepticPermit> match = Optional.empty();
        if (addressHash != null) {
            match = permitStore.findActiveByAddressHash(addressHash, countyId, stateId);
        }
        if (match.isEmpty() && permitNumber != null && !permitNumber.isBlank()) {
            match = permitStore.findActiveByPermitNumber(permitNumber, stateId);
        }
        return match;
    }

    private IngestOutcome insert(PermitRecord record, PermitContent incoming,
                                 AddressNormalizer.NormalizedLocation location, Integer stateId, Integer countyId,
                                 Instant scrapedAt, ReferenceCache cache, SourceContext source) {
        SepticPermit permit = SepticPermit.builder()
                .id(UUID.randomUUID())
                .stateId(stateId)
                .countyId(countyId)
                .addressNormalized(location.address())
                .addressHash(location.addressHash())
                .ownerNameNormalized(AddressNormalizer.normalizeOwnerName(record.getOwnerName()))
                .systemTypeId(referenceDataResolver.resolveSystemType(cache, record.getSystemType()))
                .sourcePortalId(source.portalId())
                .sourcePortalCode(source.portalCode())
                .scrapedAt(scrapedAt)
                .rawData(record.getRawData())
                .active(true)
                .dataQualityScore(incoming.completeness())
                .version(1)
                .recordHash(incoming.fingerprint())
                .createdAt(source.now())
                .updatedAt(source.now())
                .build();
        incoming.applyTo(permit);
        permitStore.insert(permit);
        return new IngestOutcome.Inserted(permit.getId());
    }

    private static PermitVersion snapshot(SepticPermit existing, PermitContent current, List<String> changedFields,
                                          Instant scrapedAt, SourceContext source) {
        Map<String, Object> permitData = current.toMap();
        permitData.put("address_normalized", existing.getAddressNormalized());
        permitData.put("source_portal_code", existing.getSourcePortalCode());
        permitData.put("scraped_at", existing.getScrapedAt() != null ? existing.getScrapedAt().toString() : null);

        return PermitVersion.builder()
                .permitId(existing.getId())
                .version(existing.getVersion())
                .permitData(permitData)
                .changedFields(changedFields)
                .changeSource(ChangeSource.SCRAPER)
                .sourcePortalId(source.portalId())
                .scrapedAt(scrapedAt)
                .createdAt(source.now())
                .createdBy(SYSTEM_USER)
                .build();
    }

    /**
     * The portal a batch came from and the time it is being ingested.
     */
    public record SourceContext(int portalId, String portalCode, Instant now) {}
}
