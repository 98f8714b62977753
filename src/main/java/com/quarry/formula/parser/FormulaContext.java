package com.quarry.formula.parser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable per-evaluation snapshot supplied by the host: where the formula lives, the clock,
 * the document fields, mentioned entities and sibling items.
 *
 * The engine never mutates a context; each evaluation gets its own instance.
 */
public final class FormulaContext {
    public final String currentDocPath;
    public final String currentBlockId;
    public final Instant now;
    /** Zone for calendar functions, or null to use the engine default. */
    public final ZoneId zone;
    public final Map<String, Value> fields;
    public final List<EntityRef> mentions;
    public final List<ItemRef> siblings;

    private FormulaContext(Builder b) {
        this.currentDocPath = b.currentDocPath;
        this.currentBlockId = b.currentBlockId;
        this.now = (b.now == null) ? Instant.now() : b.now;
        this.zone = b.zone;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
        this.mentions = Collections.unmodifiableList(new ArrayList<>(b.mentions));
        this.siblings = Collections.unmodifiableList(new ArrayList<>(b.siblings));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FormulaContext empty() {
        return new Builder().build();
    }

    /** Field lookup; absent fields read as NULL. */
    public Value field(String name) {
        Value v = fields.get(name);
        return (v == null) ? Value.nil() : v;
    }

    public List<Value> mentionValues() {
        List<Value> out = new ArrayList<>(mentions.size());
        for (EntityRef m : mentions) out.add(m.toValue());
        return out;
    }

    public List<Value> siblingValues() {
        List<Value> out = new ArrayList<>(siblings.size());
        for (ItemRef s : siblings) out.add(s.toValue());
        return out;
    }

    /** Copy of this context as a builder, for hosts deriving a new snapshot. */
    public Builder toBuilder() {
        Builder b = new Builder()
                .currentDocPath(currentDocPath)
                .currentBlockId(currentBlockId)
                .now(now)
                .zone(zone)
                .fields(fields);
        for (EntityRef m : mentions) b.mention(m);
        for (ItemRef s : siblings) b.sibling(s);
        return b;
    }

    /**
     * Reads a context from JSON:
     * {"currentDocPath", "currentBlockId", "now", "zone", "fields": {...},
     *  "mentions": [{"type", "label", "id", "properties": {...}}],
     *  "siblings": [{"id", "title", "fields": {...}}]}
     */
    public static Builder fromJson(JsonNode root) {
        Builder b = new Builder();
        if (root == null || !root.isObject()) return b;

        b.currentDocPath(root.path("currentDocPath").asText(""));
        b.currentBlockId(root.path("currentBlockId").asText(""));
        if (root.hasNonNull("now")) {
            try {
                b.now(Instant.parse(root.get("now").asText()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("context.now is not an ISO-8601 instant: " + root.get("now").asText(), e);
            }
        }
        if (root.hasNonNull("zone")) {
            try {
                b.zone(ZoneId.of(root.get("zone").asText()));
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("context.zone is not a valid zone id: " + root.get("zone").asText(), e);
            }
        }
        b.fields(ValueJson.fromJsonObject(root.get("fields")));

        JsonNode mentions = root.get("mentions");
        if (mentions != null && mentions.isArray()) {
            for (JsonNode m : mentions) {
                b.mention(new EntityRef(
                        m.path("type").asText(""),
                        m.path("label").asText(""),
                        m.hasNonNull("id") ? m.get("id").asText() : null,
                        ValueJson.fromJsonObject(m.get("properties"))));
            }
        }
        JsonNode siblings = root.get("siblings");
        if (siblings != null && siblings.isArray()) {
            for (JsonNode s : siblings) {
                b.sibling(new ItemRef(
                        s.hasNonNull("id") ? s.get("id").asText() : null,
                        s.hasNonNull("title") ? s.get("title").asText() : null,
                        ValueJson.fromJsonObject(s.get("fields"))));
            }
        }
        return b;
    }

    public static final class Builder {
        private String currentDocPath = "";
        private String currentBlockId = "";
        private Instant now;
        private ZoneId zone;
        private final Map<String, Value> fields = new LinkedHashMap<>();
        private final List<EntityRef> mentions = new ArrayList<>();
        private final List<ItemRef> siblings = new ArrayList<>();

        private Builder() {}

        public Builder currentDocPath(String path) { this.currentDocPath = (path == null) ? "" : path; return this; }
        public Builder currentBlockId(String id) { this.currentBlockId = (id == null) ? "" : id; return this; }
        public Builder now(Instant now) { this.now = now; return this; }
        public Builder zone(ZoneId zone) { this.zone = zone; return this; }

        public Builder field(String name, Value value) {
            if (name == null) throw new IllegalArgumentException("field name must not be null");
            fields.put(name, value == null ? Value.nil() : value);
            return this;
        }

        public Builder fields(Map<String, Value> values) {
            if (values != null) {
                for (Map.Entry<String, Value> e : values.entrySet()) field(e.getKey(), e.getValue());
            }
            return this;
        }

        public Builder mention(EntityRef mention) {
            if (mention != null) mentions.add(mention);
            return this;
        }

        public Builder sibling(ItemRef sibling) {
            if (sibling != null) siblings.add(sibling);
            return this;
        }

        public boolean hasZone() {
            return zone != null;
        }

        public FormulaContext build() {
            return new FormulaContext(this);
        }
    }
}
