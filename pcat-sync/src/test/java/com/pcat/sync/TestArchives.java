package com.pcat.sync;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Builds small zip archives for tests. Entries are written in insertion order. */
public final class TestArchives {

    public static final String DOCKER_STEP = """
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
                  required: true
            """;

    public static final String DOCKER_STEP_V2 = """
            version: 2
            kind: plugin
            type: step
            name: docker
            spec:
              description: Build and push a docker image (buildx)
              image: plugins/docker:2
            """;

    public static final String DEPLOY_STAGE = """
            kind: plugin
            type: stage
            name: deploy-stage
            spec:
              description: Deploy to an environment
              steps:
                - name: deploy
            """;

    public static final String PIPELINE = """
            kind: pipeline
            name: ci
            spec:
              stages: []
            """;

    public static final String BROKEN = "name: [unclosed\n  kind: : plugin";

    private final Map<String, String> entries = new LinkedHashMap<>();

    public static TestArchives archive() {
        return new TestArchives();
    }

    public TestArchives entry(String name, String content) {
        entries.put(name, content);
        return this;
    }

    public TestArchives directory(String name) {
        entries.put(name.endsWith("/") ? name : name + "/", null);
        return this;
    }

    public Path writeTo(Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                if (e.getValue() != null) {
                    zip.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        }
        return file;
    }
}
