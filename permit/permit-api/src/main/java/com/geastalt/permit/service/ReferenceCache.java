/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.permit.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference ids resolved during one ingestion batch, keyed by normalized value.
 * <p>
 * Not shared between batches. Rows created while ingesting a record are held as tentative until
 * that record commits: if the record rolls back, so did the insert, and the ids are forgotten.
 */
public class ReferenceCache {

    private final Map<String, Integer> states = new HashMap<>();
    private final Map<String, Integer> counties = new HashMap<>();
    private final Map<String, Integer> systemTypes = new HashMap<>();
    private final Map<String, Integer> portals = new HashMap<>();

    private final List<Runnable> tentative = new ArrayList<>();

    boolean hasState(String code) {
        return states.containsKey(code);
    }

    Integer state(String code) {
        return states.get(code);
    }

    void putState(String code, Integer id) {
        states.put(code, id);
    }

    Integer county(int stateId, String normalizedName) {
        return counties.get(countyKey(stateId, normalizedName));
    }

    void putCounty(int stateId, String normalizedName, int id, boolean created) {
        String key = countyKey(stateId, normalizedName);
        counties.put(key, id);
        if (created) {
            tentative.add(() -> counties.remove(key));
        }
    }

    boolean hasSystemType(String value) {
        return systemTypes.containsKey(value);
    }

    Integer systemType(String value) {
        return systemTypes.get(value);
    }

    void putSystemType(String value, Integer id) {
        systemTypes.put(value, id);
    }

    Integer portal(String code) {
        return portals.get(code);
    }

    void putPortal(String code, int id) {
        portals.put(code, id);
    }

    /**
     * The current record committed; rows it created are now durable.
     */
    public void confirmCreated() {
        tentative.clear();
    }

    /**
     * The current record rolled back; forget the rows it created.
     */
    public void discardCreated() {
        tentative.forEach(Runnable::run);
        tentative.clear();
    }

    private static String countyKey(int stateId, String normalizedName) {
        return stateId + "|" + normalizedName;
    }
}
