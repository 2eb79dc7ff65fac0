package com.scholary.watermark.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.watermark.batch.BatchSetupException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaskScannerTest {

  @TempDir Path tempDir;

  private TaskScanner scanner;
  private Path input;
  private Path output;

  @BeforeEach
  void setUp() throws IOException {
    scanner = new TaskScanner(List.of("jpg", ".JPEG", "png"));
    input = Files.createDirectory(tempDir.resolve("in"));
    output = tempDir.resolve("out").resolve("nested");
  }

  @Test
  void scan_shouldKeepOnlySupportedRegularFiles() throws IOException {
    Files.createFile(input.resolve("b.PNG"));
    Files.createFile(input.resolve("a.jpg"));
    Files.createFile(input.resolve("c.jpeg"));
    Files.createFile(input.resolve("notes.txt"));
    Files.createDirectory(input.resolve("folder.png"));

    ScanSummary summary = scanner.scan(input, output).collect();

    assertThat(summary.tasks())
        .extracting(Task::fileName)
        .containsExactly("a.jpg", "b.PNG", "c.jpeg");
    assertThat(summary.skipped())
        .containsExactlyInAnyOrder(input.resolve("notes.txt"), input.resolve("folder.png"));
    assertThat(summary.skippedCount()).isEqualTo(2);
  }

  @Test
  void scan_shouldMapDestinationsFlatIntoOutputDir() throws IOException {
    Files.createFile(input.resolve("photo.jpg"));

    Task task = scanner.scan(input, output).collect().tasks().get(0);

    assertThat(task.sourcePath()).isEqualTo(input.resolve("photo.jpg"));
    assertThat(task.destinationPath()).isEqualTo(output.resolve("photo.jpg"));
  }

  @Test
  void scan_shouldCreateOutputDirRecursively() {
    scanner.scan(input, output);

    assertThat(output).isDirectory();
  }

  @Test
  void scan_shouldExcludeOutputDirNestedInInput() throws IOException {
    Path nestedOutput = input.resolve("out");
    Files.createFile(input.resolve("a.png"));

    ScanSummary summary = scanner.scan(input, nestedOutput).collect();

    assertThat(summary.tasks()).hasSize(1);
    assertThat(summary.skipped()).isEmpty();
  }

  @Test
  void stream_shouldBeRestartable() throws IOException {
    Files.createFile(input.resolve("a.png"));
    TaskSequence sequence = scanner.scan(input, output);

    try (Stream<Task> first = sequence.stream(path -> {})) {
      assertThat(first).hasSize(1);
    }
    Files.createFile(input.resolve("b.png"));
    List<Path> skipped = new ArrayList<>();
    try (Stream<Task> second = sequence.stream(skipped::add)) {
      assertThat(second).hasSize(2);
    }
    assertThat(skipped).isEmpty();
  }

  @Test
  void scan_shouldRejectMissingInputDir() {
    assertThatThrownBy(() -> scanner.scan(tempDir.resolve("missing"), output))
        .isInstanceOf(BatchSetupException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void scan_shouldRejectFileAsInputDir() throws IOException {
    Path file = Files.createFile(tempDir.resolve("file.png"));

    assertThatThrownBy(() -> scanner.scan(file, output)).isInstanceOf(BatchSetupException.class);
  }

  @Test
  void constructor_shouldRejectEmptyExtensions() {
    assertThatThrownBy(() -> new TaskScanner(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
