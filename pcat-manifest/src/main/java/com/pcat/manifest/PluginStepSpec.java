package com.pcat.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Spec section of a step plugin manifest: a container image run as a single pipeline step. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginStepSpec {

    private final String description;
    private final String image;
    private final List<String> entrypoint;
    private final List<String> args;
    private final Map<String, String> envs;
    private final Map<String, ManifestInput> inputs;

    @JsonCreator
    public PluginStepSpec(
            @JsonProperty("description") String description,
            @JsonProperty("image") String image,
            @JsonProperty("entrypoint") List<String> entrypoint,
            @JsonProperty("args") List<String> args,
            @JsonProperty("envs") Map<String, String> envs,
            @JsonProperty("inputs") Map<String, ManifestInput> inputs) {
        this.description = description != null ? description : "";
        this.image = image;
        this.entrypoint = entrypoint != null ? Collections.unmodifiableList(new ArrayList<>(entrypoint)) : List.of();
        this.args = args != null ? Collections.unmodifiableList(new ArrayList<>(args)) : List.of();
        this.envs = envs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(envs)) : Map.of();
        this.inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
    }

    /** Human-readable description; empty string when the manifest declares none. */
    public String getDescription() {
        return description;
    }

    public String getImage() {
        return image;
    }

    public List<String> getEntrypoint() {
        return entrypoint;
    }

    public List<String> getArgs() {
        return args;
    }

    public Map<String, String> getEnvs() {
        return envs;
    }

    /** Inputs in declaration order. */
    public Map<String, ManifestInput> getInputs() {
        return inputs;
    }
}
