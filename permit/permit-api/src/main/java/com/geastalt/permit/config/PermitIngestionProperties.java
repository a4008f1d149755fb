/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "permit.ingestion")
@Getter
@Setter
public class PermitIngestionProperties {

    /**
     * Largest batch accepted; bigger batches are rejected before any record is processed.
     */
    private int maxBatchSize = 10000;

    /**
     * Records per committed chunk.
     */
    private int commitInterval = 100;

    /**
     * Error details kept per batch. Errors beyond this are still counted.
     */
    private int maxErrorDetails = 500;
}
