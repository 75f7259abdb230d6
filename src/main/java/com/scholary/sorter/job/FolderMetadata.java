package com.scholary.sorter.job;

import java.util.List;

/**
 * Snapshot of a folder's contents, captured when the job is created and refreshed when analysis
 * starts.
 *
 * @param folderName the folder's own name
 * @param totalFiles number of audio files found below the folder
 * @param files relative paths of every regular file below the folder
 */
public record FolderMetadata(String folderName, int totalFiles, List<String> files) {

  public FolderMetadata {
    files = files == null ? List.of() : List.copyOf(files);
  }

  public static FolderMetadata named(String folderName) {
    return new FolderMetadata(folderName, 0, List.of());
  }
}
