package com.pcat.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Declared plugin input: type, description, required flag, default value and allowed options. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ManifestInput {

    private final String type;
    private final String description;
    private final boolean required;
    private final JsonNode defaultValue;
    private final List<String> options;

    @JsonCreator
    public ManifestInput(
            @JsonProperty("type") String type,
            @JsonProperty("description") String description,
            @JsonProperty("required") Boolean required,
            @JsonProperty("default") JsonNode defaultValue,
            @JsonProperty("options") List<String> options) {
        this.type = type;
        this.description = description;
        this.required = required != null && required;
        this.defaultValue = defaultValue;
        this.options = options != null ? Collections.unmodifiableList(new ArrayList<>(options)) : List.of();
    }

    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRequired() {
        return required;
    }

    /** Default value as declared (scalar, list or map); null when none. */
    public JsonNode getDefaultValue() {
        return defaultValue;
    }

    public List<String> getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ManifestInput that = (ManifestInput) o;
        return required == that.required && Objects.equals(type, that.type)
                && Objects.equals(description, that.description)
                && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, description, required, defaultValue, options);
    }
}
