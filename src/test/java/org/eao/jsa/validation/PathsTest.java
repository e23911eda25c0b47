package org.eao.jsa.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireReadableDirectoryReturnsRealPath() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("headers"));
    assertEquals(dir.toRealPath(), Paths.requireReadableDirectory("in", dir));
  }

  @Test
  void requireReadableDirectoryRejectsMissingDirectory() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableDirectory("in", tempDir.resolve("missing")));
  }

  @Test
  void requireReadableDirectoryRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("header.json"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableDirectory("in", file));
  }

  @Test
  void ensureWritableDirectoryCreatesWhenRequested() {
    Path dir = tempDir.resolve("out/nested");
    Path validated = Paths.ensureWritableDirectory("out", dir, true);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void ensureWritableDirectoryRejectsMissingWithoutCreate() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.ensureWritableDirectory("out", tempDir.resolve("absent"), false));
  }
}
