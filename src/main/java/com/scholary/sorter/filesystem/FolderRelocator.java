package com.scholary.sorter.filesystem;

import java.nio.file.Path;
import java.time.Duration;

/** Moves a whole folder to its final place in the target tree. */
public interface FolderRelocator {

  /**
   * Move {@code source} to {@code destination}, all or nothing.
   *
   * <p>On return the folder is complete at {@code destination}. On failure it is complete at
   * {@code source} and nothing is left behind at the destination.
   *
   * @param timeout upper bound for the whole move
   * @throws RelocationException if the move failed or ran out of time
   */
  void relocate(Path source, Path destination, Duration timeout);
}
