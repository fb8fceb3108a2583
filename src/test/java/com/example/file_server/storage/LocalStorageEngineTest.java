package com.example.file_server.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.example.file_server.config.FileServerProperties;
import com.example.file_server.exception.DisallowedFileTypeException;
import com.example.file_server.exception.FileAlreadyExistsException;
import com.example.file_server.exception.FileTooLargeException;
import com.example.file_server.exception.InvalidFileNameException;
import com.example.file_server.exception.InvalidRequestArgumentException;
import com.example.file_server.exception.RequestStage;
import com.example.file_server.exception.ResourceNotFoundException;
import com.example.file_server.exception.StorageException;
import com.example.file_server.model.StoredFile;
import com.example.file_server.model.StoredFileContent;
import com.example.file_server.util.PathSanitizer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalStorageEngineTest {
  private static final long MAX = 1024;

  @TempDir Path tempDir;

  private Path root;
  private LocalStorageEngine engine;

  @BeforeEach
  void setUp() {
    root = tempDir.resolve("store");
    engine = newEngine(Set.of("exe", "sh"), Set.of(), Set.of("application/pdf"));
  }

  private LocalStorageEngine newEngine(
      Set<String> blocked, Set<String> allowed, Set<String> blockedTypes) {
    FileServerProperties properties =
        new FileServerProperties(
            "secret",
            root.toString(),
            "http://localhost:8008",
            MAX,
            255,
            blocked,
            allowed,
            blockedTypes,
            true,
            "test");
    return new LocalStorageEngine(properties, new PathSanitizer(properties));
  }

  private static InputStream bytes(byte[] data) {
    return new ByteArrayInputStream(data);
  }

  private static byte[] random(int size) {
    byte[] data = new byte[size];
    new Random(size).nextBytes(data);
    return data;
  }

  private List<Path> rootEntries() throws IOException {
    try (Stream<Path> entries = Files.list(root)) {
      return entries.toList();
    }
  }

  @Test
  void constructor_createsStorageRoot() {
    assertTrue(Files.isDirectory(root));
  }

  @Test
  void writeThenRead_roundTripsBytes() throws IOException {
    byte[] data = "Hello, file server!".getBytes(StandardCharsets.UTF_8);

    StoredFile stored = engine.write("a_1.txt", bytes(data), data.length, "hello.txt");

    assertEquals("a_1.txt", stored.getStoredName());
    assertEquals("hello.txt", stored.getOriginalName());
    assertEquals(data.length, stored.getSizeBytes());
    assertNotNull(stored.getCreatedAt());
    try (StoredFileContent content = engine.read("a_1.txt")) {
      assertArrayEquals(data, content.stream().readAllBytes());
      assertEquals(data.length, content.file().getSizeBytes());
      assertEquals("text/plain", content.file().getContentType());
    }
  }

  @Test
  void write_leavesNoTemporaryFilesBehind() throws IOException {
    engine.write("clean.bin", bytes(random(100)), 100, "clean.bin");

    assertEquals(List.of(root.resolve("clean.bin")), rootEntries());
  }

  @Test
  void write_declaredSizeAtMaximum_succeeds() {
    StoredFile stored = engine.write("max.bin", bytes(random((int) MAX)), MAX, "max.bin");
    assertEquals(MAX, stored.getSizeBytes());
  }

  @Test
  void write_declaredSizeOneOverMaximum_rejectedBeforeReadingAnyByte() throws IOException {
    InputStream untouchable =
        new InputStream() {
          @Override
          public int read() {
            throw new AssertionError("stream must not be read");
          }
        };

    FileTooLargeException ex =
        assertThrows(
            FileTooLargeException.class,
            () -> engine.write("big.bin", untouchable, MAX + 1, "big.bin"));

    assertEquals(RequestStage.VALIDATION, ex.getStage());
    assertEquals(MAX, ex.getMaxFileSize());
    assertTrue(rootEntries().isEmpty());
  }

  @Test
  void write_actualBytesExceedMaximum_rejectedAndTempRemoved() throws IOException {
    byte[] data = random((int) MAX + 10);

    assertThrows(FileTooLargeException.class, () -> engine.write("lie.bin", bytes(data), 10, "lie.bin"));
    assertThrows(FileTooLargeException.class, () -> engine.write("unknown.bin", bytes(data), -1, null));

    assertTrue(rootEntries().isEmpty());
  }

  @Test
  void write_empty_rejected() throws IOException {
    InvalidRequestArgumentException declared =
        assertThrows(
            InvalidRequestArgumentException.class,
            () -> engine.write("empty.txt", bytes(new byte[0]), 0, "empty.txt"));
    assertEquals("File is empty", declared.getMessage());

    assertThrows(
        InvalidRequestArgumentException.class,
        () -> engine.write("empty.txt", bytes(new byte[0]), -1, "empty.txt"));
    assertTrue(rootEntries().isEmpty());
  }

  @Test
  void write_blockedExtension_rejected() throws IOException {
    DisallowedFileTypeException ex =
        assertThrows(
            DisallowedFileTypeException.class,
            () -> engine.write("setup.exe", bytes(random(10)), 10, "setup.EXE"));
    assertEquals("File type not allowed: .exe", ex.getMessage());
    assertTrue(rootEntries().isEmpty());
  }

  @Test
  void write_extensionNotInAllowList_rejected() {
    LocalStorageEngine strict = newEngine(Set.of(), Set.of("png", "jpg"), Set.of());

    assertThrows(
        DisallowedFileTypeException.class,
        () -> strict.write("doc.txt", bytes(random(10)), 10, "doc.txt"));
    assertThrows(
        DisallowedFileTypeException.class,
        () -> strict.write("noext", bytes(random(10)), 10, "noext"));
    assertEquals(10, strict.write("pic.png", bytes(random(10)), 10, "pic.png").getSizeBytes());
  }

  @Test
  void write_blockedDetectedContentType_rejectedEvenWithHarmlessExtension() throws IOException {
    byte[] pdf = "%PDF-1.4\n%fake pdf body\n".getBytes(StandardCharsets.ISO_8859_1);

    assertThrows(
        DisallowedFileTypeException.class,
        () -> engine.write("notes.txt", bytes(pdf), pdf.length, "notes.txt"));
    assertTrue(rootEntries().isEmpty());
  }

  @Test
  void write_existingName_isNeverOverwritten() throws IOException {
    engine.write("dup.txt", bytes("first".getBytes(StandardCharsets.UTF_8)), 5, "dup.txt");

    assertThrows(
        FileAlreadyExistsException.class,
        () -> engine.write("dup.txt", bytes("second".getBytes(StandardCharsets.UTF_8)), 6, "dup.txt"));

    assertEquals("first", Files.readString(root.resolve("dup.txt")));
    assertEquals(1, rootEntries().size());
  }

  @Test
  void write_streamFailureMidUpload_cleansUpAndReportsStorageError() throws IOException {
    InputStream disconnecting =
        new InputStream() {
          private int served;

          @Override
          public int read() throws IOException {
            if (served++ < 100) {
              return 'x';
            }
            throw new IOException("client disconnected");
          }
        };

    StorageException ex =
        assertThrows(
            StorageException.class, () -> engine.write("partial.txt", disconnecting, 500, "p.txt"));

    assertEquals(RequestStage.PERSISTENCE, ex.getStage());
    assertTrue(rootEntries().isEmpty());
  }

  @Test
  void write_unsafeName_rejected() {
    assertThrows(
        InvalidFileNameException.class,
        () -> engine.write("../escape.txt", bytes(random(5)), 5, "x.txt"));
    assertFalse(Files.exists(tempDir.resolve("escape.txt")));
  }

  @Test
  void read_missing_notFound() {
    ResourceNotFoundException ex =
        assertThrows(ResourceNotFoundException.class, () -> engine.read("missing.txt"));
    assertEquals(RequestStage.RETRIEVAL, ex.getStage());
  }

  @Test
  void read_traversal_rejected() {
    assertThrows(InvalidFileNameException.class, () -> engine.read("../../etc/passwd"));
  }

  @Test
  void read_symlinkLeavingRoot_notFollowed() throws IOException {
    Path outside = Files.writeString(tempDir.resolve("secret.txt"), "top secret");
    Files.createSymbolicLink(root.resolve("link.txt"), outside);

    assertThrows(ResourceNotFoundException.class, () -> engine.read("link.txt"));
    assertTrue(engine.list().isEmpty());
  }

  @Test
  void read_afterConcurrentDelete_stillReturnsCompleteContent() throws IOException {
    byte[] data = random(512);
    engine.write("race.bin", bytes(data), data.length, "race.bin");

    try (StoredFileContent content = engine.read("race.bin")) {
      engine.delete("race.bin");
      assertArrayEquals(data, content.stream().readAllBytes());
    }
    assertThrows(ResourceNotFoundException.class, () -> engine.read("race.bin"));
  }

  @Test
  void list_newestFirst_skippingHiddenFilesAndDirectories() throws IOException {
    engine.write("old.txt", bytes(random(10)), 10, "old.txt");
    engine.write("new.txt", bytes(random(20)), 20, "new.txt");
    Files.setLastModifiedTime(root.resolve("old.txt"), FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
    Files.setLastModifiedTime(root.resolve("new.txt"), FileTime.from(Instant.parse("2025-01-01T00:00:00Z")));
    Files.writeString(root.resolve(".upload-123.part"), "in flight");
    Files.createDirectory(root.resolve("subdir"));

    List<StoredFile> files = engine.list();

    assertEquals(2, files.size());
    List<String> names = files.stream().map(StoredFile::getStoredName).toList();
    assertTrue(names.containsAll(List.of("old.txt", "new.txt")));
    for (int i = 1; i < files.size(); i++) {
      assertFalse(files.get(i).getCreatedAt().isAfter(files.get(i - 1).getCreatedAt()));
    }
    StoredFile newTxt = files.stream().filter(f -> f.getStoredName().equals("new.txt")).findFirst().orElseThrow();
    assertEquals(20, newTxt.getSizeBytes());
    assertNull(newTxt.getOriginalName());
  }

  @Test
  void list_missingRoot_isEmpty() throws IOException {
    Files.delete(root);
    assertTrue(engine.list().isEmpty());
  }

  @Test
  void delete_removesFile_andSecondDeleteReportsNotFound() {
    engine.write("gone.txt", bytes(random(3)), 3, "gone.txt");

    engine.delete("gone.txt");

    assertFalse(Files.exists(root.resolve("gone.txt")));
    ResourceNotFoundException first =
        assertThrows(ResourceNotFoundException.class, () -> engine.delete("gone.txt"));
    assertEquals(RequestStage.DELETION, first.getStage());
    assertThrows(ResourceNotFoundException.class, () -> engine.delete("gone.txt"));
  }

  @Test
  void delete_directory_notFound() throws IOException {
    Files.createDirectory(root.resolve("adir"));
    assertThrows(ResourceNotFoundException.class, () -> engine.delete("adir"));
    assertTrue(Files.isDirectory(root.resolve("adir")));
  }

  @Test
  void delete_traversal_rejected() throws IOException {
    Path victim = Files.writeString(tempDir.resolve("victim.txt"), "keep me");
    assertThrows(InvalidFileNameException.class, () -> engine.delete("../victim.txt"));
    assertTrue(Files.exists(victim));
  }
}
