package com.warden.engine.domain.recovery;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

/**
 * Age-based cleanup of regular files directly inside a directory. A missing directory holds no
 * files; files deleted concurrently are skipped.
 */
public class FileJanitor {

    static final String GZIP_SUFFIX = ".gz";

    private final Clock clock;

    public FileJanitor(Clock clock) {
        this.clock = clock;
    }

    /**
     * Deletes files last modified more than {@code maxAge} ago.
     *
     * @return number of files deleted
     */
    public int deleteOlderThan(Path dir, Duration maxAge) throws IOException {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Path file : regularFiles(dir)) {
            if (modifiedBefore(file, cutoff) && Files.deleteIfExists(file)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Gzips files last modified more than {@code age} ago into {@code <name>.gz} and removes the
     * originals. Files already ending in {@code .gz} are left alone.
     *
     * @return number of files compressed
     */
    public int compressOlderThan(Path dir, Duration age) throws IOException {
        Instant cutoff = clock.instant().minus(age);
        int compressed = 0;
        for (Path file : regularFiles(dir)) {
            if (file.getFileName().toString().endsWith(GZIP_SUFFIX) || !modifiedBefore(file, cutoff)) {
                continue;
            }
            Path target = file.resolveSibling(file.getFileName() + GZIP_SUFFIX);
            try (InputStream in = Files.newInputStream(file);
                 OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
                in.transferTo(out);
            } catch (NoSuchFileException e) {
                Files.deleteIfExists(target);
                continue;
            }
            Files.setLastModifiedTime(target, Files.getLastModifiedTime(file));
            Files.deleteIfExists(file);
            compressed++;
        }
        return compressed;
    }

    private static List<Path> regularFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile).toList();
        }
    }

    private static boolean modifiedBefore(Path file, Instant cutoff) throws IOException {
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            return modified.toInstant().isBefore(cutoff);
        } catch (NoSuchFileException e) {
            return false;
        }
    }
}
