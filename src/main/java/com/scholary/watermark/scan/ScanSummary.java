package com.scholary.watermark.scan;

import java.nio.file.Path;
import java.util.List;

/** Materialised result of one pass over a {@link TaskSequence}. */
public record ScanSummary(List<Task> tasks, List<Path> skipped) {

  public ScanSummary {
    tasks = List.copyOf(tasks);
    skipped = List.copyOf(skipped);
  }

  public int skippedCount() {
    return skipped.size();
  }
}
