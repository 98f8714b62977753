package com.quarry.formula.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** An entity mentioned in the current document (a place, person, project...). */
public final class EntityRef {
    public final String type;
    public final String label;
    public final String id;
    public final Map<String, Value> properties;

    public EntityRef(String type, String label, String id, Map<String, Value> properties) {
        this.type = (type == null) ? "" : type;
        this.label = (label == null) ? "" : label;
        this.id = id;
        this.properties = Collections.unmodifiableMap(properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties));
    }

    public EntityRef(String type, String label) {
        this(type, label, null, null);
    }

    /** MAP form handed to formula functions: {type, label, id, properties}. */
    public Value toValue() {
        Map<String, Value> m = new LinkedHashMap<>();
        m.put("type", Value.text(type));
        m.put("label", Value.text(label));
        m.put("id", Value.text(id));
        m.put("properties", Value.map(properties));
        return Value.map(m);
    }
}
