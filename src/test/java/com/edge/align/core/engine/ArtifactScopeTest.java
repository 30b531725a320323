package com.edge.align.core.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactScopeTest {

    @TempDir
    Path workDir;

    /**
     * 真正写出空文件的引擎，用于检查落盘清理
     */
    private static class DiskEngine extends FakeImageEngine {
        @Override
        public void write(ImageHandle image, Path path) {
            super.write(image, path);
            try {
                Files.createFile(path);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    @Test
    void releasesInReverseOrder() {
        List<String> closed = new ArrayList<>();
        try (ArtifactScope scope = ArtifactScope.inMemory("order")) {
            scope.track((AutoCloseable) () -> closed.add("first"));
            scope.track((AutoCloseable) () -> closed.add("second"));
            scope.track((AutoCloseable) () -> closed.add("third"));
            assertEquals(3, scope.size());
        }
        assertEquals(Arrays.asList("third", "second", "first"), closed);
    }

    @Test
    void closeIsIdempotent() {
        FakeImage image = new FakeImage("edge", 10, 10);
        ArtifactScope scope = ArtifactScope.inMemory("twice");
        scope.track(image, "edge");
        scope.close();
        scope.close();
        assertEquals(1, image.getCloseCount());
    }

    @Test
    void trackingAfterCloseFails() {
        ArtifactScope scope = ArtifactScope.inMemory("closed");
        scope.close();
        assertThrows(IllegalStateException.class, () -> scope.track(new FakeImage("late", 1, 1), "late"));
    }

    @Test
    void failingReleaseDoesNotStopOthers() {
        FakeImage image = new FakeImage("kept", 10, 10);
        try (ArtifactScope scope = ArtifactScope.inMemory("failing")) {
            scope.track(image, "kept");
            scope.track((AutoCloseable) () -> {
                throw new IllegalStateException("boom");
            });
        }
        assertTrue(image.isClosed());
    }

    @Test
    void dumpedFilesAreDeletedOnClose() {
        DiskEngine engine = new DiskEngine();
        List<Path> files;
        try (ArtifactScope scope = new ArtifactScope("edge-based", engine, workDir, false)) {
            scope.track(new FakeImage("edge", 10, 10), "edge-ref");
            scope.track(new FakeImage("resized", 5, 5), "resized-ref");
            files = scope.getFiles();
            assertEquals(2, files.size());
            for (Path file : files) {
                assertTrue(Files.exists(file));
                assertTrue(file.getFileName().toString().startsWith(scope.getId()));
            }
        }
        for (Path file : files) {
            assertFalse(Files.exists(file));
        }
    }

    @Test
    void dumpedFilesAreKeptWhenConfigured() {
        DiskEngine engine = new DiskEngine();
        List<Path> files;
        try (ArtifactScope scope = new ArtifactScope("cropped-region", engine, workDir, true)) {
            scope.track(new FakeImage("crop", 10, 10), "crop");
            files = scope.getFiles();
        }
        assertEquals(1, files.size());
        assertTrue(Files.exists(files.get(0)));
    }

    @Test
    void dumpFailureIsNotFatal() {
        FakeImageEngine engine = new FakeImageEngine().failingWrites();
        FakeImage image = new FakeImage("edge", 10, 10);
        try (ArtifactScope scope = new ArtifactScope("edge-based", engine, workDir, false)) {
            scope.track(image, "edge");
            assertTrue(scope.getFiles().isEmpty());
        }
        assertTrue(image.isClosed());
    }

    @Test
    void idsDoNotCollide() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(ArtifactScope.newId("multi-scale"));
        }
        assertEquals(1000, ids.size());
    }
}
