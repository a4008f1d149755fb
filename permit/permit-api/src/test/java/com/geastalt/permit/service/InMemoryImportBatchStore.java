/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.entity.PermitImportBatch;
import com.geastalt.permit.repository.ImportBatchStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

class InMemoryImportBatchStore implements ImportBatchStore {

    final List<PermitImportBatch> started = new ArrayList<>();
    final List<PermitImportBatch> finished = new ArrayList<>();
    final List<PortalScrape> portalScrapes = new ArrayList<>();

    @Override
    public void start(PermitImportBatch batch) {
        started.add(batch);
    }

    @Override
    public void finish(PermitImportBatch batch) {
        finished.add(batch);
    }

    @Override
    public void recordPortalScrape(int sourcePortalId, Instant scrapedAt, int recordCount) {
        portalScrapes.add(new PortalScrape(sourcePortalId, scrapedAt, recordCount));
    }

    record PortalScrape(int portalId, Instant scrapedAt, int recordCount) {}
}
