/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.entity;

import java.util.Objects;
import java.util.UUID;

/**
 * Whether a permit is the authoritative record for its key.
 * <p>
 * Persisted as {@code is_active} plus {@code duplicate_of_id}; code that needs to know if a
 * record is authoritative switches on this type instead of reading the two columns.
 */
public sealed interface PermitStatus permits PermitStatus.Active, PermitStatus.Inactive {

    Active ACTIVE = new Active();

    static PermitStatus of(boolean active, UUID duplicateOfId) {
        if (active) {
            return ACTIVE;
        }
        return duplicateOfId != null
                ? new Inactive(InactiveReason.DUPLICATE, duplicateOfId)
                : new Inactive(InactiveReason.DEACTIVATED, null);
    }

    default boolean isActive() {
        return this instanceof Active;
    }

    record Active() implements PermitStatus {}

    record Inactive(InactiveReason reason, UUID canonicalId) implements PermitStatus {
        public Inactive {
            Objects.requireNonNull(reason, "reason");
            if (reason == InactiveReason.DUPLICATE && canonicalId == null) {
                throw new IllegalArgumentException("A duplicate must name its canonical permit");
            }
        }
    }

    enum InactiveReason {
        DUPLICATE,
        DEACTIVATED
    }
}
