/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What caused a permit version to be written.
 */
public enum ChangeSource {
    SCRAPER,
    MANUAL,
    MERGE,
    API;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
