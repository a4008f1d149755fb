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
@ConfigurationProperties(prefix = "permit.events")
@Getter
@Setter
public class PermitEventProperties {

    private boolean enabled = true;

    private Topics topics = new Topics();

    @Getter
    @Setter
    public static class Topics {
        /**
         * Receives the ids of inserted and updated permits for the duplicate detection pass.
         */
        private String duplicateCheck = "permit.duplicate-check";
    }
}
