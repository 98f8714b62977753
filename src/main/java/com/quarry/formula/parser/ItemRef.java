package com.quarry.formula.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A sibling item (block, row, task) next to the formula, with its own fields. */
public final class ItemRef {
    public final String id;
    public final String title;
    public final Map<String, Value> fields;

    public ItemRef(String id, String title, Map<String, Value> fields) {
        this.id = id;
        this.title = title;
        this.fields = Collections.unmodifiableMap(fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields));
    }

    /** MAP form handed to formula functions: {id, title, fields}. */
    public Value toValue() {
        Map<String, Value> m = new LinkedHashMap<>();
        m.put("id", Value.text(id));
        m.put("title", Value.text(title));
        m.put("fields", Value.map(fields));
        return Value.map(m);
    }
}
