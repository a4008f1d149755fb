/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Septic permit ingestion and search service.
 *
 * <p>Scrapers post batches of permit records which are normalized, matched against existing
 * permits by address hash or permit number, and inserted, updated (with a version snapshot) or
 * skipped. The same store backs a hybrid full-text and trigram search with facets, a statistics
 * overview and the duplicate review workflow.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class PermitApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PermitApiApplication.class, args);
    }
}
