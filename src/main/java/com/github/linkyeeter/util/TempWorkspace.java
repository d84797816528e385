package com.github.linkyeeter.util;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scratch directory owned by a single task, deleted with all its contents on close.
 * Ownership moves with the {@code TaskOutput} that wraps it, so the directory lives
 * as long as somebody needs the video inside.
 */
@Slf4j
public class TempWorkspace implements Closeable {

    private final Path directory;
    private volatile boolean closed = false;

    private TempWorkspace(Path directory) {
        this.directory = directory;
    }

    /**
     * Create a fresh workspace directory under the given parent.
     *
     * @param parent Parent directory, created if missing
     * @return Open workspace
     * @throws IOException if the directory cannot be created
     */
    public static TempWorkspace create(Path parent) throws IOException {
        Files.createDirectories(parent);
        Path directory = Files.createTempDirectory(parent, MediaConstants.WORKSPACE_PREFIX);
        log.debug("Created workspace: {}", directory);
        return new TempWorkspace(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Resolve a file name inside the workspace.
     */
    public Path resolve(String filename) {
        return directory.resolve(filename);
    }

    /**
     * List the regular files directly inside the workspace, sorted by name.
     *
     * @return Files in the workspace
     * @throws IOException if the directory cannot be read
     */
    public List<Path> listFiles() throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Delete a single file inside the workspace if it exists.
     *
     * @param file File to delete
     * @return true if a file was deleted
     */
    public boolean deleteFile(Path file) {
        try {
            boolean deleted = Files.deleteIfExists(file);
            if (deleted) {
                log.debug("Deleted workspace file: {}", file);
            }
            return deleted;
        } catch (IOException e) {
            log.warn("Failed to delete workspace file: {}", file, e);
            return false;
        }
    }

    /**
     * Recursively delete the workspace directory. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.delete(path);
                        } catch (IOException e) {
                            log.warn("Failed to delete: {}", path, e);
                        }
                    });
            log.debug("Deleted workspace: {}", directory);
        } catch (IOException e) {
            log.warn("Failed to delete workspace: {}", directory, e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "TempWorkspace{" + directory + (closed ? ", closed" : "") + "}";
    }
}
