package com.scholary.watermark.scan;

import com.scholary.watermark.batch.BatchSetupException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Restartable, lazy sequence of tasks over one input directory.
 *
 * <p>Every call to {@link #stream(Consumer)} re-lists the directory, so the sequence reflects the
 * directory as it is when consumed. Nothing here reads file contents.
 */
public final class TaskSequence {

  private final Path inputDir;
  private final Path outputDir;
  private final Set<String> supportedExtensions;

  TaskSequence(Path inputDir, Path outputDir, Set<String> supportedExtensions) {
    this.inputDir = inputDir;
    this.outputDir = outputDir;
    this.supportedExtensions = supportedExtensions;
  }

  /**
   * Lazily stream the eligible tasks. The caller must close the stream.
   *
   * @param onSkipped receives every entry that is not an eligible image
   * @throws IOException if the directory cannot be listed
   */
  public Stream<Task> stream(Consumer<Path> onSkipped) throws IOException {
    return Files.list(inputDir)
        .filter(entry -> !isOutputDir(entry))
        .filter(
            entry -> {
              if (isEligible(entry)) {
                return true;
              }
              onSkipped.accept(entry);
              return false;
            })
        .map(entry -> new Task(entry, outputDir.resolve(entry.getFileName())));
  }

  /**
   * Walk the sequence once and collect tasks, sorted by file name, plus the skipped entries.
   *
   * @throws BatchSetupException if the directory cannot be listed
   */
  public ScanSummary collect() {
    List<Path> skipped = new ArrayList<>();
    try (Stream<Task> tasks = stream(skipped::add)) {
      List<Task> sorted = tasks.sorted(Comparator.comparing(Task::fileName)).toList();
      skipped.sort(Comparator.naturalOrder());
      return new ScanSummary(sorted, skipped);
    } catch (IOException e) {
      throw new BatchSetupException("Failed to list input directory: " + inputDir, e);
    }
  }

  boolean isEligible(Path entry) {
    return Files.isRegularFile(entry) && supportedExtensions.contains(extensionOf(entry));
  }

  private boolean isOutputDir(Path entry) {
    try {
      return Files.isDirectory(entry) && Files.isSameFile(entry, outputDir);
    } catch (IOException e) {
      return false;
    }
  }

  static String extensionOf(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
