package io.gdcc.healthdcat.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed node of the output graph. The identifier and type are fixed at construction; properties
 * are appended while the graph is built and keep insertion order.
 */
public final class Entity {
    private final String identifier;
    private final String type;
    private final Map<String, List<Value>> properties = new LinkedHashMap<>();

    Entity(String identifier, String type) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String identifier() {
        return identifier;
    }

    public String type() {
        return type;
    }

    /** Adds a value unless the same value is already present for the property. */
    public Entity add(String predicateIri, Value value) {
        List<Value> values = properties.computeIfAbsent(predicateIri, k -> new ArrayList<>());
        if (!values.contains(value)) {
            values.add(value);
        }
        return this;
    }

    public Entity addReference(String predicateIri, Entity target) {
        return add(predicateIri, Value.ref(target.identifier()));
    }

    public List<Value> values(String predicateIri) {
        List<Value> values = properties.get(predicateIri);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public Map<String, List<Value>> properties() {
        return Collections.unmodifiableMap(properties);
    }

    @Override
    public String toString() {
        return "Entity{" + identifier + " a " + type + "}";
    }
}
