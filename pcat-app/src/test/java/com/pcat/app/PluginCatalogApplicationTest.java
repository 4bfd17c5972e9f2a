package com.pcat.app;

import com.pcat.config.CatalogConfig;
import com.pcat.store.InMemoryPluginStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class PluginCatalogApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void run_syncsLocalArchiveIntoInMemoryCatalog() throws IOException {
        Path zip = writeEchoArchive();

        assertEquals(0, PluginCatalogApplication.run(config(zip.toString())));
    }

    @Test
    void run_failsWithoutArchiveLocation() {
        assertEquals(1, PluginCatalogApplication.run(config(null)));
    }

    @Test
    void run_failsWhenArchiveCannotBeOpened() throws IOException {
        Path notAZip = Files.writeString(tempDir.resolve("plugins.zip"), "plain text");

        assertEquals(1, PluginCatalogApplication.run(config(notAZip.toString())));
    }

    @Test
    void run_failsWhenCatalogDatabaseIsUnreachable() throws IOException {
        Path zip = writeEchoArchive();
        CatalogConfig config = CatalogConfig.builder()
                .pluginsZipPath(zip.toString())
                .tempDir(tempDir.toString())
                .catalogDbEnabled(true)
                .dbHost("127.0.0.1")
                .dbPort(closedPort())
                .build();

        assertEquals(1, PluginCatalogApplication.run(config));
    }

    @Test
    void createStore_usesInMemoryCatalogWhenDatabaseDisabled() {
        assertInstanceOf(InMemoryPluginStore.class, PluginCatalogApplication.createStore(config(null)));
    }

    private Path writeEchoArchive() throws IOException {
        Path zip = tempDir.resolve("plugins.zip");
        try (OutputStream out = Files.newOutputStream(zip);
             ZipOutputStream zos = new ZipOutputStream(out)) {
            zos.putNextEntry(new ZipEntry("plugins/echo/plugin.yaml"));
            zos.write("""
                    kind: plugin
                    type: step
                    name: echo
                    spec:
                      image: alpine
                    """.getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        return zip;
    }

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return socket.getLocalPort();
        }
    }

    private CatalogConfig config(String location) {
        return CatalogConfig.builder()
                .pluginsZipPath(location)
                .tempDir(tempDir.toString())
                .catalogDbEnabled(false)
                .build();
    }
}
