package com.scholary.sorter.filesystem;

import com.scholary.sorter.job.FolderMetadata;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Read-only view of the music library on disk.
 *
 * <p>Abstracts the enumeration primitives so the scan and analyze stages can be tested without a
 * real library.
 */
public interface FolderInspector {

  /**
   * Immediate, non-hidden sub-directories of {@code root}, sorted by name.
   *
   * @throws IOException if {@code root} is missing or cannot be read
   */
  List<Path> listSubdirectories(Path root) throws IOException;

  /**
   * Capture name, audio file count and relative file list of a folder.
   *
   * @throws IOException if the folder is missing or cannot be walked
   */
  FolderMetadata snapshot(Path folder) throws IOException;

  /**
   * Count audio files directly inside and anywhere below a folder, and list its sub-directories.
   *
   * @throws IOException if the folder is missing or cannot be walked
   */
  FolderStructure structure(Path folder) throws IOException;
}
