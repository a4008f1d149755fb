/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import java.util.List;
import java.util.UUID;

/**
 * What happened to one ingested record. Failures that roll the record back are reported as
 * exceptions instead.
 */
public sealed interface IngestOutcome {

    record Inserted(UUID permitId) implements IngestOutcome {}

    record Updated(UUID permitId, int version, List<String> changedFields) implements IngestOutcome {}

    record Skipped(UUID permitId) implements IngestOutcome {}

    /**
     * The record was refused before anything was written.
     */
    record Rejected(String reason) implements IngestOutcome {}
}
