/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.model;

import java.util.function.Function;

/**
 * The business fields of a permit, in canonical order.
 * <p>
 * This single list drives the record hash, the change diff and the version snapshot. A field
 * that is hashed but not diffed (or the reverse) would make unchanged re-scrapes look like updates.
 */
public enum PermitField {
    PERMIT_NUMBER("permit_number", PermitContent::permitNumber),
    ADDRESS("address", PermitContent::address),
    CITY("city", PermitContent::city),
    ZIP_CODE("zip_code", PermitContent::zipCode),
    PARCEL_NUMBER("parcel_number", PermitContent::parcelNumber),
    LATITUDE("latitude", PermitContent::latitude),
    LONGITUDE("longitude", PermitContent::longitude),
    OWNER_NAME("owner_name", PermitContent::ownerName),
    APPLICANT_NAME("applicant_name", PermitContent::applicantName),
    CONTRACTOR_NAME("contractor_name", PermitContent::contractorName),
    INSTALL_DATE("install_date", PermitContent::installDate),
    PERMIT_DATE("permit_date", PermitContent::permitDate),
    EXPIRATION_DATE("expiration_date", PermitContent::expirationDate),
    SYSTEM_TYPE_RAW("system_type_raw", PermitContent::systemTypeRaw),
    TANK_SIZE_GALLONS("tank_size_gallons", PermitContent::tankSizeGallons),
    DRAINFIELD_SIZE_SQFT("drainfield_size_sqft", PermitContent::drainfieldSizeSqft),
    BEDROOMS("bedrooms", PermitContent::bedrooms),
    DAILY_FLOW_GPD("daily_flow_gpd", PermitContent::dailyFlowGpd),
    PDF_URL("pdf_url", PermitContent::pdfUrl),
    PERMIT_URL("permit_url", PermitContent::permitUrl);

    private final String columnName;
    private final Function<PermitContent, Object> accessor;

    PermitField(String columnName, Function<PermitContent, Object> accessor) {
        this.columnName = columnName;
        this.accessor = accessor;
    }

    public String columnName() {
        return columnName;
    }

    public Object valueOf(PermitContent content) {
        return accessor.apply(content);
    }
}
