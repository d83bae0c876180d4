package com.eavstore.core.model;

import com.eavstore.core.value.AttrValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An entity as read back from the store, with its decoded attributes.
 */
public record Entity(String key, long created, long modified, Map<String, AttrValue> attrs) {

    public Entity {
        attrs = Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    }

    public AttrValue attr(String name) {
        return attrs.get(name);
    }
}
