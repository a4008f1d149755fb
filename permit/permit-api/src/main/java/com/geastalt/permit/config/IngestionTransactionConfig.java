/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transactions for batch ingestion: one transaction per chunk of records, and a savepoint per
 * record inside it so a failing record rolls back alone.
 */
@Slf4j
@Configuration
public class IngestionTransactionConfig {

    public static final String CHUNK_TEMPLATE = "ingestionChunkTransactionTemplate";
    public static final String RECORD_TEMPLATE = "ingestionRecordTransactionTemplate";

    @Bean(CHUNK_TEMPLATE)
    public TransactionTemplate ingestionChunkTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setName("permit-ingestion-chunk");
        return template;
    }

    @Bean(RECORD_TEMPLATE)
    public TransactionTemplate ingestionRecordTransactionTemplate(PlatformTransactionManager transactionManager) {
        // savepoints cover the JDBC connection only; the ingestion path never writes through JPA
        if (transactionManager instanceof AbstractPlatformTransactionManager manager
                && !manager.isNestedTransactionAllowed()) {
            log.info("Enabling savepoint-based nested transactions on {}", manager.getClass().getSimpleName());
            manager.setNestedTransactionAllowed(true);
        }
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        template.setName("permit-ingestion-record");
        return template;
    }
}
