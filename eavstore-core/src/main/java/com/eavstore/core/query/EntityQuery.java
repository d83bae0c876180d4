package com.eavstore.core.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative entity query. An empty {@code attrsToSelect} returns every attribute.
 */
public record EntityQuery(List<String> attrsToSelect, List<AttrFilter> attrFilters, List<EntFilter> entFilters) {

    public EntityQuery {
        attrsToSelect = attrsToSelect == null ? List.of() : List.copyOf(attrsToSelect);
        attrFilters = attrFilters == null ? List.of() : List.copyOf(attrFilters);
        entFilters = entFilters == null ? List.of() : List.copyOf(entFilters);
    }

    public static EntityQuery all() {
        return new EntityQuery(null, null, null);
    }

    public static EntityQuery byKey(String key) {
        return builder().entFilter(EntFilter.keyEquals(key)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> attrsToSelect = new ArrayList<>();
        private final List<AttrFilter> attrFilters = new ArrayList<>();
        private final List<EntFilter> entFilters = new ArrayList<>();

        public Builder select(String... attrs) {
            attrsToSelect.addAll(List.of(attrs));
            return this;
        }

        public Builder select(List<String> attrs) {
            attrsToSelect.addAll(attrs);
            return this;
        }

        public Builder attrFilter(AttrFilter filter) {
            attrFilters.add(filter);
            return this;
        }

        public Builder attrFilter(String attr, String op, Object arg) {
            return attrFilter(AttrFilter.binary(attr, op, arg));
        }

        public Builder entFilter(EntFilter filter) {
            entFilters.add(filter);
            return this;
        }

        public Builder entFilter(String col, String op, Object arg) {
            return entFilter(new EntFilter(col, op, arg));
        }

        public EntityQuery build() {
            return new EntityQuery(attrsToSelect, attrFilters, entFilters);
        }
    }
}
