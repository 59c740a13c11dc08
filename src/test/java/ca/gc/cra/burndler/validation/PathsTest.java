package ca.gc.cra.burndler.validation;

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
  void validateWritableDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    Path validated = Paths.validateWritableDir(dir, null, false, true);
    assertEquals(dir.toRealPath(), validated);
  }

  @Test
  void validateWritableDirRejectsNonEmptyDirectoryWithoutReuse() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("nonEmpty"));
    Files.createFile(dir.resolve("file.txt"));
    assertThrows(IllegalArgumentException.class, () ->
        Paths.validateWritableDir(dir, null, false, false));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path dir = tempDir.resolve("missing/child");
    Path validated = Paths.validateWritableDir(dir, null, true, false);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirRejectsMissingDirectoryWithoutCreation() {
    Path dir = tempDir.resolve("absent");
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        Paths.validateWritableDir(dir, null, false, true));
    assertTrue(ex.getMessage().startsWith("directory does not exist"));
  }

  @Test
  void validateWritableDirRejectsEscapeFromBase() {
    Path base = tempDir.resolve("base");
    assertThrows(IllegalArgumentException.class, () ->
        Paths.validateWritableDir(base.resolve("../outside"), base, true, true));
  }

  @Test
  void requireReadableFileAcceptsRegularFiles() throws IOException {
    Path file = Files.writeString(tempDir.resolve("compose.yaml"), "services: {}\n");
    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("in", file));
  }

  @Test
  void requireReadableFileRejectsMissingFilesAndDirectories() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
        Paths.requireReadableFile("in", tempDir.resolve("nope.yaml")));
    assertTrue(ex.getMessage().startsWith("in file not found: "));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
  }
}
