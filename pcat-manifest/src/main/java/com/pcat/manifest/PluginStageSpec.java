package com.pcat.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Spec section of a stage plugin manifest: a reusable group of steps. Steps are kept as raw trees. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginStageSpec {

    private final String description;
    private final Map<String, ManifestInput> inputs;
    private final List<JsonNode> steps;

    @JsonCreator
    public PluginStageSpec(
            @JsonProperty("description") String description,
            @JsonProperty("inputs") Map<String, ManifestInput> inputs,
            @JsonProperty("steps") List<JsonNode> steps) {
        this.description = description != null ? description : "";
        this.inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
        this.steps = steps != null ? Collections.unmodifiableList(new ArrayList<>(steps)) : List.of();
    }

    public String getDescription() {
        return description;
    }

    public Map<String, ManifestInput> getInputs() {
        return inputs;
    }

    public List<JsonNode> getSteps() {
        return steps;
    }
}
