package com.pcat.sync.archive;

import com.pcat.config.CatalogConfig;
import com.pcat.config.CatalogConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Turns an archive location (local path or http(s) URL) into a locally readable file. Remote archives are
 * streamed into a temporary file that the returned {@link ResolvedArchive} deletes on close; if resolution fails
 * the temporary file is removed before the exception propagates.
 */
public final class ArchiveSourceResolver {

    private static final Logger log = LoggerFactory.getLogger(ArchiveSourceResolver.class);
    private static final String SETTING = "PCAT_PLUGINS_ZIP_PATH";
    private static final String TEMP_PREFIX = "plugins";
    private static final String TEMP_SUFFIX = ".zip";
    private static final int BUFFER_SIZE = 64 * 1024;

    private final HttpClient httpClient;
    private final Path tempDir;
    private final Duration requestTimeout;

    public ArchiveSourceResolver(HttpClient httpClient, Path tempDir, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tempDir = Objects.requireNonNull(tempDir, "tempDir");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public static ArchiveSourceResolver fromConfig(CatalogConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(config.getHttpConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new ArchiveSourceResolver(client, Path.of(config.getTempDir()), config.getHttpRequestTimeout());
    }

    /**
     * Resolves the archive location.
     *
     * @param location existing local file path, or http(s) URL
     * @return a handle to close when the archive is no longer needed
     * @throws CatalogConfigurationException when no location is supplied
     * @throws ArchiveTransportException     when the remote fetch fails or returns a non-2xx status
     * @throws IOException                   when the temporary file cannot be created or written
     */
    public ResolvedArchive resolve(String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new CatalogConfigurationException(SETTING, "plugins path not provided to read schemas from");
        }
        String trimmed = location.trim();
        Path local = asExistingLocalFile(trimmed);
        if (local != null) {
            log.info("Using local plugins archive {}", local);
            return ResolvedArchive.local(local);
        }
        URI uri = toRemoteUri(trimmed);
        Path temp = Files.createTempFile(tempDir, TEMP_PREFIX, TEMP_SUFFIX);
        boolean downloaded = false;
        try {
            long bytes = download(uri, temp);
            log.info("Downloaded plugins archive from {} to {} ({} bytes)", uri, temp, bytes);
            downloaded = true;
        } finally {
            if (!downloaded) {
                deleteQuietly(temp);
            }
        }
        return ResolvedArchive.temporary(temp);
    }

    private static Path asExistingLocalFile(String location) {
        try {
            Path p = Path.of(location);
            return Files.exists(p) ? p : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static URI toRemoteUri(String location) throws ArchiveTransportException {
        URI uri;
        try {
            uri = URI.create(location);
        } catch (IllegalArgumentException e) {
            throw new ArchiveTransportException("archive location is neither an existing file nor a valid URL: " + location, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new ArchiveTransportException("archive location is neither an existing file nor an http(s) URL: " + location);
        }
        return uri;
    }

    /** Returns the number of bytes written to {@code target}. */
    private long download(URI uri, Path target) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveTransportException("interrupted while fetching " + uri, e);
        } catch (IOException e) {
            throw new ArchiveTransportException("could not get zip from url " + uri + ": " + e.getMessage(), e);
        }
        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new ArchiveTransportException("could not get zip from url " + uri + ": HTTP " + status, status, null);
            }
            if (body == null) {
                throw new ArchiveTransportException("empty response body from " + uri, status, null);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                return copy(uri, body, out);
            }
        }
    }

    /** Read failures are transport errors; write failures stay plain {@link IOException}s. */
    private static long copy(URI uri, InputStream body, OutputStream out) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        while (true) {
            int n;
            try {
                n = body.read(buffer);
            } catch (IOException e) {
                throw new ArchiveTransportException("could not read response body from " + uri + ": " + e.getMessage(), e);
            }
            if (n < 0) {
                return total;
            }
            out.write(buffer, 0, n);
            total += n;
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary archive {}: {}", temp, e.getMessage());
        }
    }
}
