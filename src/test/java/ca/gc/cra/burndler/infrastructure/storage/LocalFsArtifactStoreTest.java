package ca.gc.cra.burndler.infrastructure.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFsArtifactStoreTest {

  @TempDir Path tempDir;

  @Test
  void uploadWritesUnderBaseAndReturnsAbsolutePath() throws IOException {
    LocalFsArtifactStore store = new LocalFsArtifactStore(tempDir.resolve("storage"), 1);
    byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

    String locator = store.upload("packages/shop-1.tar.gz", content);

    Path expected = store.baseDir().resolve("packages/shop-1.tar.gz");
    assertEquals(expected.toAbsolutePath().toString(), locator);
    assertArrayEquals(content, Files.readAllBytes(expected));
    assertArrayEquals(content, store.download("packages/shop-1.tar.gz"));
    try (Stream<Path> files = Files.list(expected.getParent())) {
      assertEquals(1, files.count(), "temporary upload file should be gone");
    }
  }

  @Test
  void uploadReplacesExistingObject() throws IOException {
    LocalFsArtifactStore store = new LocalFsArtifactStore(tempDir, 1);
    store.upload("a.txt", new byte[] {1});
    store.upload("a.txt", new byte[] {2, 3});

    assertArrayEquals(new byte[] {2, 3}, store.download("a.txt"));
  }

  @Test
  void downloadOfMissingKeyNamesTheKey() {
    LocalFsArtifactStore store = new LocalFsArtifactStore(tempDir, 1);

    IOException ex = assertThrows(IOException.class, () -> store.download("templates/none.yaml"));
    assertEquals("artifact not found: templates/none.yaml", ex.getMessage());
  }

  @Test
  void keysAreConfinedToBaseDirectory() throws IOException {
    LocalFsArtifactStore store = new LocalFsArtifactStore(tempDir.resolve("root"), 1);

    store.upload("../../escape.txt", new byte[] {9});

    assertTrue(Files.exists(store.baseDir().resolve("escape.txt")));
    assertTrue(Files.notExists(tempDir.resolve("escape.txt")));
    assertEquals("a/b/c", LocalFsArtifactStore.normalizeKey("/a/./b\\..\\c"));
    assertThrows(IllegalArgumentException.class, () -> store.download("/../"));
  }

  @Test
  void rejectsUploadsOverTheLimit() {
    LocalFsArtifactStore store = new LocalFsArtifactStore(tempDir, 1);

    assertThrows(IOException.class, () -> store.upload("big.bin", new byte[1024 * 1024 + 1]));
  }

  @Test
  void rejectsOutOfRangeLimit() {
    assertThrows(IllegalArgumentException.class, () -> new LocalFsArtifactStore(tempDir, 0));
  }
}
