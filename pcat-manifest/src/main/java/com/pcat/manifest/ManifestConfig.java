package com.pcat.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Parsed plugin manifest: the top-level header ({@code version}, {@code kind}, {@code type}, {@code name})
 * plus the {@code spec} section bound to the shape selected by {@link #getVariant()}.
 * Exactly one of {@link #getStep()} / {@link #getStage()} is non-null for the plugin variants; both are null for
 * {@link ManifestVariant#OTHER}, whose spec is only available as a raw tree.
 */
public final class ManifestConfig {

    private final String version;
    private final String kind;
    private final String type;
    private final String name;
    private final ManifestVariant variant;
    private final PluginStepSpec step;
    private final PluginStageSpec stage;
    private final JsonNode spec;

    private ManifestConfig(String version, String kind, String type, String name, ManifestVariant variant,
                           PluginStepSpec step, PluginStageSpec stage, JsonNode spec) {
        this.version = version;
        this.kind = kind;
        this.type = type;
        this.name = name;
        this.variant = Objects.requireNonNull(variant, "variant");
        this.step = step;
        this.stage = stage;
        this.spec = spec != null ? spec : MissingNode.getInstance();
    }

    static ManifestConfig step(String version, String kind, String type, String name, PluginStepSpec step, JsonNode spec) {
        return new ManifestConfig(version, kind, type, name, ManifestVariant.PLUGIN_STEP,
                Objects.requireNonNull(step, "step"), null, spec);
    }

    static ManifestConfig stage(String version, String kind, String type, String name, PluginStageSpec stage, JsonNode spec) {
        return new ManifestConfig(version, kind, type, name, ManifestVariant.PLUGIN_STAGE,
                null, Objects.requireNonNull(stage, "stage"), spec);
    }

    static ManifestConfig other(String version, String kind, String type, String name, JsonNode spec) {
        return new ManifestConfig(version, kind, type, name, ManifestVariant.OTHER, null, null, spec);
    }

    /** Declared manifest version (e.g. "1"); null when absent. */
    public String getVersion() {
        return version;
    }

    public String getKind() {
        return kind;
    }

    public String getType() {
        return type;
    }

    /** Declared name; used as the catalog identifier. May be null or blank in malformed manifests. */
    public String getName() {
        return name;
    }

    public ManifestVariant getVariant() {
        return variant;
    }

    public PluginStepSpec getStep() {
        return step;
    }

    public PluginStageSpec getStage() {
        return stage;
    }

    /** Raw {@code spec} tree (never null; {@link MissingNode} when the manifest has no spec). */
    public JsonNode getSpec() {
        return spec;
    }

    /**
     * Description of a plugin manifest, or empty for {@link ManifestVariant#OTHER}.
     */
    public Optional<String> getPluginDescription() {
        return switch (variant) {
            case PLUGIN_STEP -> Optional.of(step.getDescription());
            case PLUGIN_STAGE -> Optional.of(stage.getDescription());
            case OTHER -> Optional.empty();
        };
    }
}
