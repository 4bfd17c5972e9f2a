package com.pcat.manifest;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ManifestParserTest {

    private static final String STEP_YAML = """
            version: 1
            kind: plugin
            type: step
            name: docker
            spec:
              description: Build and push a docker image
              image: plugins/docker
              inputs:
                repo:
                  type: string
                  description: image repository
                  required: true
                tags:
                  type: string
                  default: latest
                  options: [latest, stable]
              outputs:
                digest: {}
            """;

    private static final String STAGE_YAML = """
            kind: plugin
            type: stage
            name: deploy-stage
            spec:
              description: Deploy to an environment
              inputs:
                environment:
                  type: string
              steps:
                - name: deploy
                  type: script
            """;

    @Test
    void parse_stepPlugin() {
        ManifestConfig config = ManifestParser.parse(STEP_YAML.getBytes(StandardCharsets.UTF_8));

        assertEquals(ManifestVariant.PLUGIN_STEP, config.getVariant());
        assertEquals("1", config.getVersion());
        assertEquals("plugin", config.getKind());
        assertEquals("step", config.getType());
        assertEquals("docker", config.getName());
        assertNull(config.getStage());
        PluginStepSpec step = config.getStep();
        assertNotNull(step);
        assertEquals("Build and push a docker image", step.getDescription());
        assertEquals("plugins/docker", step.getImage());
        assertEquals(2, step.getInputs().size());
        assertTrue(step.getInputs().get("repo").isRequired());
        assertEquals("latest", step.getInputs().get("tags").getDefaultValue().asText());
        assertEquals(2, step.getInputs().get("tags").getOptions().size());
        assertEquals("Build and push a docker image", config.getPluginDescription().orElseThrow());
    }

    @Test
    void parse_stagePlugin() {
        ManifestConfig config = ManifestParser.parse(STAGE_YAML);

        assertEquals(ManifestVariant.PLUGIN_STAGE, config.getVariant());
        assertEquals("deploy-stage", config.getName());
        assertNull(config.getStep());
        assertEquals("Deploy to an environment", config.getStage().getDescription());
        assertEquals(1, config.getStage().getSteps().size());
        assertEquals("deploy", config.getStage().getSteps().get(0).path("name").asText());
    }

    @Test
    void parse_otherKindIsNotRejected() {
        ManifestConfig config = ManifestParser.parse("""
                kind: pipeline
                name: build
                spec:
                  stages: []
                """);

        assertEquals(ManifestVariant.OTHER, config.getVariant());
        assertTrue(config.getPluginDescription().isEmpty());
        assertTrue(config.getSpec().has("stages"));
    }

    @Test
    void parse_unknownPluginTypeIsOther() {
        ManifestConfig config = ManifestParser.parse("kind: plugin\ntype: trigger\nname: cron\n");

        assertEquals(ManifestVariant.OTHER, config.getVariant());
    }

    @Test
    void parse_stepWithoutSpecHasEmptyDescription() {
        ManifestConfig config = ManifestParser.parse("kind: plugin\ntype: step\nname: bare\n");

        assertEquals(ManifestVariant.PLUGIN_STEP, config.getVariant());
        assertEquals("", config.getStep().getDescription());
        assertTrue(config.getSpec().isMissingNode());
    }

    @Test
    void parse_invalidYamlThrows() {
        assertThrows(ManifestParseException.class,
                () -> ManifestParser.parse("kind: plugin\ntype: step\nname: [unclosed\n"));
    }

    @Test
    void parse_emptyDocumentThrows() {
        assertThrows(ManifestParseException.class, () -> ManifestParser.parse(""));
    }

    @Test
    void parse_nonMappingRootThrows() {
        assertThrows(ManifestParseException.class, () -> ManifestParser.parse("- just\n- a list\n"));
    }

    @Test
    void parse_specOfWrongShapeThrows() {
        assertThrows(ManifestParseException.class,
                () -> ManifestParser.parse("kind: plugin\ntype: step\nname: x\nspec: not-a-mapping\n"));
        assertThrows(ManifestParseException.class,
                () -> ManifestParser.parse("kind: plugin\ntype: step\nname: x\nspec:\n  inputs: [1, 2]\n"));
    }

    @Test
    void parse_nonScalarNameThrows() {
        assertThrows(ManifestParseException.class,
                () -> ManifestParser.parse("kind: plugin\ntype: step\nname:\n  nested: true\n"));
    }

    @Test
    void parse_keepsEmptyListItems() {
        ManifestConfig step = ManifestParser.parse("""
                kind: plugin
                type: step
                name: echo
                spec:
                  image: alpine
                  args:
                    - hello
                    -
                  inputs:
                    level:
                      options: [~, debug]
                """);

        assertEquals(Arrays.asList("hello", null), step.getStep().getArgs());
        assertEquals(Arrays.asList(null, "debug"), step.getStep().getInputs().get("level").getOptions());

        ManifestConfig stage = ManifestParser.parse("""
                kind: plugin
                type: stage
                name: deploy
                spec:
                  steps:
                    - name: first
                    -
                """);

        assertEquals(2, stage.getStage().getSteps().size());
    }
}
