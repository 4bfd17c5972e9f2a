package com.pcat.sync.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Selects plugin manifests from a zip archive. An entry is a manifest when its path matches the glob
 * (default {@value #DEFAULT_PATTERN}: {@code plugins/<dir>/<file>.yaml} at the archive root or under any number of
 * leading directories). For each manifest, a {@value #LOGO_FILE} in the same directory is attached when present.
 * <p>
 * Unreadable entries and logos are logged and skipped; they never abort the pass.
 */
public final class ManifestExtractor {

    public static final String DEFAULT_PATTERN = "{**/,}plugins/*/*.yaml";
    static final String LOGO_FILE = "logo.svg";
    private static final Logger log = LoggerFactory.getLogger(ManifestExtractor.class);

    private final String pattern;
    private final PathMatcher matcher;

    public ManifestExtractor() {
        this(DEFAULT_PATTERN);
    }

    /**
     * @param pattern glob over archive entry names
     * @throws IllegalArgumentException when the pattern is malformed
     */
    public ManifestExtractor(String pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Lazily reads matching entries in archive order. The stream reads from {@code zip}, so it must be consumed
     * before the zip is closed; it can be consumed only once.
     */
    public Stream<ManifestEntry> extract(ZipFile zip) {
        Objects.requireNonNull(zip, "zip");
        return zip.stream()
                .filter(e -> !e.isDirectory())
                .filter(e -> matches(e.getName()))
                .map(e -> read(zip, e))
                .flatMap(Optional::stream);
    }

    /** Whether an archive entry name is a manifest path. */
    public boolean matches(String entryName) {
        try {
            return matcher.matches(Path.of(entryName));
        } catch (InvalidPathException e) {
            log.debug("Ignoring archive entry with unusable name {}: {}", entryName, e.getMessage());
            return false;
        }
    }

    private Optional<ManifestEntry> read(ZipFile zip, ZipEntry entry) {
        byte[] manifest;
        try (InputStream in = zip.getInputStream(entry)) {
            manifest = in.readAllBytes();
        } catch (IOException e) {
            log.warn("could not read file contents | name={} error={}", entry.getName(), e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new ManifestEntry(entry.getName(), manifest, readLogo(zip, entry.getName())));
    }

    private byte[] readLogo(ZipFile zip, String manifestName) {
        String logoName = siblingOf(manifestName, LOGO_FILE);
        ZipEntry logo = zip.getEntry(logoName);
        if (logo == null || logo.isDirectory()) {
            return null;
        }
        try (InputStream in = zip.getInputStream(logo)) {
            return in.readAllBytes();
        } catch (IOException e) {
            log.warn("could not copy logo file | name={} logo={} error={}", manifestName, logoName, e.getMessage());
            return null;
        }
    }

    static String siblingOf(String entryName, String fileName) {
        int slash = entryName.lastIndexOf('/');
        return slash >= 0 ? entryName.substring(0, slash + 1) + fileName : fileName;
    }
}
