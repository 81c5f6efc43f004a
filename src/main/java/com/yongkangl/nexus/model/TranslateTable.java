package com.yongkangl.nexus.model;

import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Integer keys of a TRANSLATE command mapped to the taxon names they stand for, in the order they
 * were declared.
 */
public final class TranslateTable {
    public static final TranslateTable EMPTY = new TranslateTable(Collections.emptyMap());

    private final Map<Integer, String> entries;

    public TranslateTable(Map<Integer, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public String get(int key) {
        return entries.get(key);
    }

    public boolean containsKey(int key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    // First key declared for the name, or null.
    public Integer keyFor(String name) {
        for (Map.Entry<Integer, String> entry : entries.entrySet()) {
            if (entry.getValue().equals(name)) {
                return entry.getKey();
            }
        }
        return null;
    }

    public List<Pair<Integer, String>> entries() {
        List<Pair<Integer, String>> list = new ArrayList<>();
        for (Map.Entry<Integer, String> entry : entries.entrySet()) {
            list.add(Pair.of(entry.getKey(), entry.getValue()));
        }
        return list;
    }

    public Map<Integer, String> asMap() {
        return entries;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
