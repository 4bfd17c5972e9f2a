package com.pcat.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Parses plugin manifest YAML into {@link ManifestConfig}. Structural validation only: the header must be a
 * mapping and, for plugin variants, the {@code spec} section must bind to {@link PluginStepSpec} or
 * {@link PluginStageSpec}. Unknown fields are ignored.
 */
public final class ManifestParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ManifestParser() {
    }

    /**
     * Parses manifest bytes (UTF-8 YAML).
     *
     * @param content raw manifest bytes
     * @return parsed manifest (variant may be {@link ManifestVariant#OTHER})
     * @throws ManifestParseException on invalid YAML or a spec that does not match the declared plugin shape
     */
    public static ManifestConfig parse(byte[] content) {
        Objects.requireNonNull(content, "content");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new ManifestParseException("invalid manifest yaml: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    /** Parses a manifest previously stored as text (e.g. a catalog entry's spec). */
    public static ManifestConfig parse(String content) {
        Objects.requireNonNull(content, "content");
        return parse(content.getBytes(StandardCharsets.UTF_8));
    }

    private static ManifestConfig fromTree(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ManifestParseException("manifest is empty");
        }
        if (!root.isObject()) {
            throw new ManifestParseException("manifest root must be a mapping, got " + root.getNodeType());
        }
        String version = scalar(root, "version");
        String kind = scalar(root, "kind");
        String type = scalar(root, "type");
        String name = scalar(root, "name");
        JsonNode spec = root.path("spec");

        ManifestVariant variant = ManifestVariant.of(kind, type);
        return switch (variant) {
            case PLUGIN_STEP -> ManifestConfig.step(version, kind, type, name, bind(spec, PluginStepSpec.class), spec);
            case PLUGIN_STAGE -> ManifestConfig.stage(version, kind, type, name, bind(spec, PluginStageSpec.class), spec);
            case OTHER -> ManifestConfig.other(version, kind, type, name, spec);
        };
    }

    private static <T> T bind(JsonNode spec, Class<T> shape) {
        if (spec.isMissingNode() || spec.isNull()) {
            spec = YAML_MAPPER.createObjectNode();
        }
        if (!spec.isObject()) {
            throw new ManifestParseException("manifest spec must be a mapping for " + shape.getSimpleName()
                    + ", got " + spec.getNodeType());
        }
        try {
            return YAML_MAPPER.treeToValue(spec, shape);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ManifestParseException("manifest spec does not match " + shape.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static String scalar(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new ManifestParseException("manifest field '" + field + "' must be a scalar, got " + node.getNodeType());
        }
        return node.asText();
    }
}
