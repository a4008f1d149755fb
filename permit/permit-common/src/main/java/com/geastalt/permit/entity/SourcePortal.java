/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A government portal permits are scraped from, e.g. {@code florida_ebridge}.
 */
@Entity
@Table(name = "source_portals", schema = "public")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourcePortal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false, unique = true, length = 100)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "state_id")
    private Integer stateId;

    @Column(length = 50)
    private String platform;

    @Column(name = "base_url")
    private String baseUrl;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "last_scraped_at")
    private Instant lastScrapedAt;

    @Builder.Default
    @Column(name = "total_records_scraped", nullable = false)
    private long totalRecordsScraped = 0;

    /**
     * Display name for a portal first seen by code: {@code florida_ebridge -> Florida Ebridge}.
     */
    public static String nameFromCode(String code) {
        StringBuilder name = new StringBuilder();
        for (String word : code.replace('_', ' ').trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (!name.isEmpty()) {
                name.append(' ');
            }
            name.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase());
        }
        return name.toString();
    }
}
