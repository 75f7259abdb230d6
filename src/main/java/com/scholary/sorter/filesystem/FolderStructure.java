package com.scholary.sorter.filesystem;

import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Audio layout of one top-level folder, enough to tell an album from an artist collection.
 *
 * @param directAudioFiles audio files directly inside the folder
 * @param totalAudioFiles audio files anywhere below the folder
 * @param subdirectories immediate, non-hidden sub-directories, sorted by name
 */
public record FolderStructure(
    int directAudioFiles, int totalAudioFiles, List<Path> subdirectories) {

  /** How a scanned folder is turned into jobs. */
  public enum Shape {
    /** No audio anywhere below; not enqueued. */
    EMPTY,
    SINGLE_ALBUM,
    /** Disc sub-folders of one album; enqueued as a single job. */
    MULTI_DISC_ALBUM,
    /** One album per sub-folder; each sub-folder becomes its own job. */
    ARTIST_COLLECTION
  }

  private static final Pattern DISC_NAME = Pattern.compile("(?i).*(cd|disc|disk|vol).*");
  private static final int MAX_DISCS = 6;

  public FolderStructure {
    subdirectories = subdirectories == null ? List.of() : List.copyOf(subdirectories);
  }

  public Shape shape() {
    if (totalAudioFiles == 0) {
      return Shape.EMPTY;
    }
    int folders = subdirectories.size();
    if (directAudioFiles > 0 || folders < 2) {
      return Shape.SINGLE_ALBUM;
    }
    if (folders <= MAX_DISCS && discLikeFolders() * 2 >= folders) {
      return Shape.MULTI_DISC_ALBUM;
    }
    return Shape.ARTIST_COLLECTION;
  }

  private long discLikeFolders() {
    return subdirectories.stream()
        .filter(folder -> DISC_NAME.matcher(String.valueOf(folder.getFileName())).matches())
        .count();
  }
}
