package com.pcat.manifest;

/**
 * Shape of a parsed manifest, resolved from its {@code kind} and {@code type}.
 * Only {@link #PLUGIN_STEP} and {@link #PLUGIN_STAGE} are catalogable; every other
 * kind/type combination resolves to {@link #OTHER}.
 */
public enum ManifestVariant {
    /** {@code kind: plugin}, {@code type: step}. */
    PLUGIN_STEP,
    /** {@code kind: plugin}, {@code type: stage}. */
    PLUGIN_STAGE,
    /** Any other kind/type (pipeline, template, unknown plugin type, missing kind). */
    OTHER;

    static final String KIND_PLUGIN = "plugin";
    static final String TYPE_STEP = "step";
    static final String TYPE_STAGE = "stage";

    public static ManifestVariant of(String kind, String type) {
        if (kind == null || !KIND_PLUGIN.equals(kind.trim())) return OTHER;
        if (type == null) return OTHER;
        return switch (type.trim()) {
            case TYPE_STEP -> PLUGIN_STEP;
            case TYPE_STAGE -> PLUGIN_STAGE;
            default -> OTHER;
        };
    }
}
