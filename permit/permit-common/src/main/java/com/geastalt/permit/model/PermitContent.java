/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geastalt.permit.dto.PermitRecord;
import com.geastalt.permit.entity.SepticPermit;
import com.geastalt.permit.normalize.AddressNormalizer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The business content of a permit, independent of identity, references and bookkeeping columns.
 */
public record PermitContent(
        String permitNumber,
        String address,
        String city,
        String zipCode,
        String parcelNumber,
        Double latitude,
        Double longitude,
        String ownerName,
        String applicantName,
        String contractorName,
        LocalDate installDate,
        LocalDate permitDate,
        LocalDate expirationDate,
        String systemTypeRaw,
        Integer tankSizeGallons,
        Integer drainfieldSizeSqft,
        Integer bedrooms,
        Integer dailyFlowGpd,
        String pdfUrl,
        String permitUrl) {

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper();

    public static PermitContent of(SepticPermit permit) {
        return new PermitContent(
                permit.getPermitNumber(), permit.getAddress(), permit.getCity(), permit.getZipCode(),
                permit.getParcelNumber(), permit.getLatitude(), permit.getLongitude(),
                permit.getOwnerName(), permit.getApplicantName(), permit.getContractorName(),
                permit.getInstallDate(), permit.getPermitDate(), permit.getExpirationDate(),
                permit.getSystemTypeRaw(), permit.getTankSizeGallons(), permit.getDrainfieldSizeSqft(),
                permit.getBedrooms(), permit.getDailyFlowGpd(), permit.getPdfUrl(), permit.getPermitUrl());
    }

    public static PermitContent of(PermitRecord record) {
        return new PermitContent(
                record.getPermitNumber(), record.getAddress(), record.getCity(), record.getZipCode(),
                record.getParcelNumber(), record.getLatitude(), record.getLongitude(),
                record.getOwnerName(), record.getApplicantName(), record.getContractorName(),
                record.getInstallDate(), record.getPermitDate(), record.getExpirationDate(),
                record.getSystemType(), record.getTankSizeGallons(), record.getDrainfieldSizeSqft(),
                record.getBedrooms(), record.getDailyFlowGpd(), record.getPdfUrl(), record.getPermitUrl());
    }

    /**
     * This content with every non-null value of {@code incoming} written over it. Null incoming
     * values never erase existing data.
     */
    public PermitContent overlay(PermitContent incoming) {
        return new PermitContent(
                pick(incoming.permitNumber, permitNumber),
                pick(incoming.address, address),
                pick(incoming.city, city),
                pick(incoming.zipCode, zipCode),
                pick(incoming.parcelNumber, parcelNumber),
                pick(incoming.latitude, latitude),
                pick(incoming.longitude, longitude),
                pick(incoming.ownerName, ownerName),
                pick(incoming.applicantName, applicantName),
                pick(incoming.contractorName, contractorName),
                pick(incoming.installDate, installDate),
                pick(incoming.permitDate, permitDate),
                pick(incoming.expirationDate, expirationDate),
                pick(incoming.systemTypeRaw, systemTypeRaw),
                pick(incoming.tankSizeGallons, tankSizeGallons),
                pick(incoming.drainfieldSizeSqft, drainfieldSizeSqft),
                pick(incoming.bedrooms, bedrooms),
                pick(incoming.dailyFlowGpd, dailyFlowGpd),
                pick(incoming.pdfUrl, pdfUrl),
                pick(incoming.permitUrl, permitUrl));
    }

    /**
     * Column names of the fields that {@link #overlay} would change.
     */
    public List<String> changedFields(PermitContent incoming) {
        List<String> changed = new ArrayList<>();
        for (PermitField field : PermitField.values()) {
            Object newValue = field.valueOf(incoming);
            if (newValue != null && !Objects.equals(newValue, field.valueOf(this))) {
                changed.add(field.columnName());
            }
        }
        return changed;
    }

    /**
     * Field values keyed by column name in canonical order, dates as ISO strings.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (PermitField field : PermitField.values()) {
            Object value = field.valueOf(this);
            values.put(field.columnName(), value instanceof LocalDate date ? date.toString() : value);
        }
        return values;
    }

    /**
     * SHA-256 of the canonical JSON of {@link #toMap()}, hex encoded.
     */
    public String fingerprint() {
        try {
            return AddressNormalizer.sha256Hex(CANONICAL_JSON.writeValueAsString(toMap()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize permit content", e);
        }
    }

    /**
     * Share of content fields that are populated, 0 to 100.
     */
    public int completeness() {
        PermitField[] fields = PermitField.values();
        int populated = 0;
        for (PermitField field : fields) {
            if (field.valueOf(this) != null) {
                populated++;
            }
        }
        return Math.round(100f * populated / fields.length);
    }

    /**
     * Writes these values onto {@code permit}, including nulls.
     */
    public void applyTo(SepticPermit permit) {
        permit.setPermitNumber(permitNumber);
        permit.setAddress(address);
        permit.setCity(city);
        permit.setZipCode(zipCode);
        permit.setParcelNumber(parcelNumber);
        permit.setLatitude(latitude);
        permit.setLongitude(longitude);
        permit.setOwnerName(ownerName);
        permit.setApplicantName(applicantName);
        permit.setContractorName(contractorName);
        permit.setInstallDate(installDate);
        permit.setPermitDate(permitDate);
        permit.setExpirationDate(expirationDate);
        permit.setSystemTypeRaw(systemTypeRaw);
        permit.setTankSizeGallons(tankSizeGallons);
        permit.setDrainfieldSizeSqft(drainfieldSizeSqft);
        permit.setBedrooms(bedrooms);
        permit.setDailyFlowGpd(dailyFlowGpd);
        permit.setPdfUrl(pdfUrl);
        permit.setPermitUrl(permitUrl);
    }

    private static <T> T pick(T incoming, T current) {
        return incoming != null ? incoming : current;
    }
}
