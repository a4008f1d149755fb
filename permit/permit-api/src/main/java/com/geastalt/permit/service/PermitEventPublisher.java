/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import com.geastalt.permit.config.PermitEventProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.UUID;

/**
 * Announces inserted and updated permits so the duplicate detection pass can examine them.
 * Call only after the permits have been committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermitEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final PermitEventProperties eventProperties;

    public void publishDuplicateCheck(Collection<UUID> permitIds) {
        if (!eventProperties.isEnabled() || permitIds.isEmpty()) {
            return;
        }
        String topic = eventProperties.getTopics().getDuplicateCheck();
        log.debug("Publishing {} permits for duplicate check to {}", permitIds.size(), topic);

        for (UUID permitId : permitIds) {
            String payload = permitId.toString();
            try {
                kafkaTemplate.send(topic, payload, payload)
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                log.error("Failed to publish duplicate check: topic={}, permitId={}", topic, permitId, ex);
                            } else {
                                log.debug("Published duplicate check: topic={}, permitId={}, offset={}",
                                        topic, permitId, result.getRecordMetadata().offset());
                            }
                        });
            } catch (RuntimeException e) {
                // the permits are already committed, so a failed announcement must not fail the batch
                log.error("Failed to send duplicate check: topic={}, permitId={}", topic, permitId, e);
            }
        }
    }
}
