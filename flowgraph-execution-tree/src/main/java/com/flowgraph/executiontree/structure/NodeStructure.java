package com.flowgraph.executiontree.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Shape of one task node: name, description and fixed inputs. The task body is never part of
 * the structure, so a node read back from JSON cannot run until a body is supplied again.
 */
public final class NodeStructure {

    private final String name;
    private final String description;
    private final Map<String, Object> fixedInputs;

    @JsonCreator
    public NodeStructure(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("fixedInputs") Map<String, Object> fixedInputs) {
        this.name = name;
        this.description = description != null ? description : "";
        // LinkedHashMap keeps declaration order and tolerates null values (Map.copyOf does not)
        this.fixedInputs = fixedInputs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fixedInputs))
                : Map.of();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getFixedInputs() {
        return fixedInputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeStructure that = (NodeStructure) o;
        return Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(fixedInputs, that.fixedInputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, fixedInputs);
    }
}
