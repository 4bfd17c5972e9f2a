/**
 * Plugin manifest model and parser.
 *
 * <ul>
 *   <li>{@link com.pcat.manifest.ManifestParser} – YAML bytes or stored text to {@link com.pcat.manifest.ManifestConfig}</li>
 *   <li>{@link com.pcat.manifest.ManifestVariant} – step plugin, stage plugin, or anything else</li>
 *   <li>{@link com.pcat.manifest.PluginStepSpec} / {@link com.pcat.manifest.PluginStageSpec} – typed spec sections</li>
 * </ul>
 */
package com.pcat.manifest;
