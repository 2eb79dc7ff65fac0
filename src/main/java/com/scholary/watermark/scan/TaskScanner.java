package com.scholary.watermark.scan;

import com.scholary.watermark.batch.BatchSetupException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the images to watermark in an input directory.
 *
 * <p>Only regular files with a supported extension (case-insensitive) become tasks. Each task's
 * destination is the output directory plus the source file name; subdirectories are not mirrored.
 */
public class TaskScanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TaskScanner.class);

  private final Set<String> supportedExtensions;

  public TaskScanner(Collection<String> supportedExtensions) {
    this.supportedExtensions =
        supportedExtensions.stream()
            .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .collect(Collectors.toUnmodifiableSet());
    if (this.supportedExtensions.isEmpty()) {
      throw new IllegalArgumentException("At least one supported extension is required");
    }
  }

  public Set<String> supportedExtensions() {
    return supportedExtensions;
  }

  /**
   * Prepare a task sequence for a batch.
   *
   * <p>Creates the output directory (recursively) before returning.
   *
   * @param inputDir directory holding the source images
   * @param outputDir directory receiving the watermarked copies
   * @return a lazy, restartable sequence of tasks
   * @throws BatchSetupException if the input is not a directory or the output cannot be created
   */
  public TaskSequence scan(Path inputDir, Path outputDir) {
    if (inputDir == null || !Files.isDirectory(inputDir)) {
      throw new BatchSetupException("Input directory does not exist: " + inputDir);
    }
    if (outputDir == null) {
      throw new BatchSetupException("Output directory is required");
    }

    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new BatchSetupException("Failed to create output directory: " + outputDir, e);
    }

    LOGGER.debug(
        "Scanning {} -> {} for extensions {}", inputDir, outputDir, supportedExtensions);
    return new TaskSequence(inputDir, outputDir, supportedExtensions);
  }
}
