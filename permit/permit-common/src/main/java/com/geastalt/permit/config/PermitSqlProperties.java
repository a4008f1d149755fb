/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Static SQL used by the JDBC repositories, bound from {@code permit.sql.*}. The search
 * statement is assembled in code because its filters and ordering vary per request.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "permit.sql")
public class PermitSqlProperties {

    private Permit permit = new Permit();
    private Reference reference = new Reference();
    private Batch batch = new Batch();
    private Stats stats = new Stats();

    @Data
    public static class Permit {
        private String findActiveByAddressHash;
        private String findActiveByPermitNumber;
        private String insert;
        private String update;
        private String insertVersion;
    }

    @Data
    public static class Reference {
        private String findStateIdByCode;
        private String findCountyId;
        private String upsertCounty;
        private String findSystemTypeIdByCode;
        private String findSystemTypeIdByName;
        private String findSourcePortalIdByCode;
        private String upsertSourcePortal;
    }

    @Data
    public static class Batch {
        private String insert;
        private String finish;
        private String recordPortalScrape;
    }

    @Data
    public static class Stats {
        private String totals;
        private String activePortals;
        private String pendingDuplicates;
        private String topStates;
        private String byYear;
    }
}
