package com.scholary.watermark.scan;

import java.nio.file.Path;
import java.util.Objects;

/** One unit of work: a source image and where its watermarked copy goes. */
public record Task(Path sourcePath, Path destinationPath) {

  public Task {
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(destinationPath, "destinationPath");
  }

  public String fileName() {
    return sourcePath.getFileName().toString();
  }
}
