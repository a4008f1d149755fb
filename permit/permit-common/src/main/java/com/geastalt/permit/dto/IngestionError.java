/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.dto;

/**
 * A record that could not be ingested. {@code index} is its position in the submitted batch.
 */
public record IngestionError(int index, String permitNumber, String address, String error) {
}
