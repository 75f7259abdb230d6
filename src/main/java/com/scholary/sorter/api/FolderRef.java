package com.scholary.sorter.api;

import java.nio.file.Path;
import java.nio.file.Paths;

/** A folder as shown in pick lists: absolute path plus display name. */
public record FolderRef(String path, String name) {

  public static FolderRef of(String path) {
    Path fileName = Paths.get(path).getFileName();
    return new FolderRef(path, fileName == null ? path : fileName.toString());
  }
}
