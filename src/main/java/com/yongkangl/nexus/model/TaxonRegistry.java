package com.yongkangl.nexus.model;

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class TaxonRegistry {
    private final List<String> names;
    private final Map<String, Integer> indices;
    private final boolean caseSensitive;

    private TaxonRegistry(List<String> names, boolean caseSensitive) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.caseSensitive = caseSensitive;
        this.indices = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            indices.put(key(names.get(i), caseSensitive), i);
        }
    }

    public static TaxonRegistry of(List<String> names, boolean caseSensitive) {
        Builder builder = new Builder(caseSensitive);
        for (String name : names) {
            builder.add(name);
        }
        return builder.build();
    }

    public int size() {
        return names.size();
    }

    public String get(int index) {
        return names.get(index);
    }

    public int indexOf(String name) {
        Integer index = indices.get(key(name, caseSensitive));
        return index == null ? -1 : index;
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    private static String key(String name, boolean caseSensitive) {
        return caseSensitive ? name : name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return names.toString();
    }

    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Integer> indices = new HashMap<>();
        private final boolean caseSensitive;

        public Builder(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
        }

        public int add(String name) {
            Validate.notNull(name, "Taxon name must not be null");
            String key = key(name, caseSensitive);
            Validate.isTrue(!indices.containsKey(key), "Duplicate taxon: %s", name);
            indices.put(key, names.size());
            names.add(name);
            return names.size() - 1;
        }

        public int addIfAbsent(String name) {
            int index = indexOf(name);
            return index >= 0 ? index : add(name);
        }

        public int indexOf(String name) {
            Integer index = indices.get(key(name, caseSensitive));
            return index == null ? -1 : index;
        }

        public String get(int index) {
            return names.get(index);
        }

        public int size() {
            return names.size();
        }

        public TaxonRegistry build() {
            return new TaxonRegistry(names, caseSensitive);
        }
    }
}
