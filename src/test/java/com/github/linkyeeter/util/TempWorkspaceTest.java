package com.github.linkyeeter.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TempWorkspace")
class TempWorkspaceTest {

    @TempDir
    Path tempDir;

    private TempWorkspace workspace;

    @BeforeEach
    void setUp() throws IOException {
        workspace = TempWorkspace.create(tempDir);
    }

    @AfterEach
    void tearDown() {
        workspace.close();
    }

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("should create directory under parent")
        void shouldCreateDirectoryUnderParent() {
            assertTrue(Files.isDirectory(workspace.getDirectory()));
            assertEquals(tempDir, workspace.getDirectory().getParent());
            assertTrue(workspace.getDirectory().getFileName().toString()
                    .startsWith(MediaConstants.WORKSPACE_PREFIX));
        }

        @Test
        @DisplayName("should create missing parent directories")
        void shouldCreateMissingParentDirectories() throws IOException {
            Path parent = tempDir.resolve("a").resolve("b");

            try (TempWorkspace nested = TempWorkspace.create(parent)) {
                assertTrue(Files.isDirectory(nested.getDirectory()));
            }
        }

        @Test
        @DisplayName("two workspaces should not share a directory")
        void twoWorkspacesShouldNotShareDirectory() throws IOException {
            try (TempWorkspace other = TempWorkspace.create(tempDir)) {
                assertNotEquals(workspace.getDirectory(), other.getDirectory());
            }
        }
    }

    @Nested
    @DisplayName("listFiles")
    class ListFilesTests {

        @Test
        @DisplayName("should return empty list for empty workspace")
        void shouldReturnEmptyListForEmptyWorkspace() throws IOException {
            assertTrue(workspace.listFiles().isEmpty());
        }

        @Test
        @DisplayName("should list regular files sorted by name")
        void shouldListRegularFilesSorted() throws IOException {
            Files.createFile(workspace.resolve("b.mp4"));
            Files.createFile(workspace.resolve("a.webm"));
            Files.createDirectory(workspace.resolve("subdir"));

            List<Path> files = workspace.listFiles();

            assertEquals(List.of(workspace.resolve("a.webm"), workspace.resolve("b.mp4")), files);
        }
    }

    @Nested
    @DisplayName("deleteFile")
    class DeleteFileTests {

        @Test
        @DisplayName("should delete existing file")
        void shouldDeleteExistingFile() throws IOException {
            Path file = Files.createFile(workspace.resolve("partial.mp4"));

            assertTrue(workspace.deleteFile(file));
            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("should return false for missing file")
        void shouldReturnFalseForMissingFile() {
            assertFalse(workspace.deleteFile(workspace.resolve("missing.mp4")));
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("should delete directory with contents")
        void shouldDeleteDirectoryWithContents() throws IOException {
            Files.createFile(workspace.resolve("video.mp4"));
            Path nested = Files.createDirectory(workspace.resolve("nested"));
            Files.createFile(nested.resolve("file.txt"));

            workspace.close();

            assertFalse(Files.exists(workspace.getDirectory()));
            assertTrue(workspace.isClosed());
        }

        @Test
        @DisplayName("close should be idempotent")
        void closeShouldBeIdempotent() {
            workspace.close();

            assertDoesNotThrow(() -> workspace.close());
            assertTrue(workspace.isClosed());
        }

        @Test
        @DisplayName("should handle already deleted directory gracefully")
        void shouldHandleAlreadyDeletedDirectory() throws IOException {
            Files.delete(workspace.getDirectory());

            assertDoesNotThrow(() -> workspace.close());
        }

        @Test
        @DisplayName("should cleanup when used with try-with-resources")
        void shouldCleanupWithTryWithResources() throws IOException {
            Path directory;
            try (TempWorkspace auto = TempWorkspace.create(tempDir)) {
                directory = auto.getDirectory();
                Files.createFile(auto.resolve("video.mp4"));
            }

            assertFalse(Files.exists(directory));
        }
    }
}
