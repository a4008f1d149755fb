/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.repository;

import com.geastalt.permit.entity.PermitImportBatch;

import java.time.Instant;

public interface ImportBatchStore {

    void start(PermitImportBatch batch);

    void finish(PermitImportBatch batch);

    void recordPortalScrape(int sourcePortalId, Instant scrapedAt, int recordCount);
}
