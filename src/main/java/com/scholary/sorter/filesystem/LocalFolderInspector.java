package com.scholary.sorter.filesystem;

import com.scholary.sorter.job.FolderMetadata;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/** {@link FolderInspector} over the local filesystem. */
@Component
public class LocalFolderInspector implements FolderInspector {

  static final Set<String> AUDIO_EXTENSIONS =
      Set.of("mp3", "flac", "m4a", "mp4", "ogg", "opus", "wav");

  @Override
  public List<Path> listSubdirectories(Path root) throws IOException {
    if (!Files.exists(root)) {
      throw new NoSuchFileException(root.toString());
    }
    if (!Files.isDirectory(root)) {
      throw new NotDirectoryException(root.toString());
    }

    List<Path> folders = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
      for (Path entry : entries) {
        if (!isHidden(entry)) {
          folders.add(entry.toAbsolutePath().normalize());
        }
      }
    }
    folders.sort(Path::compareTo);
    return folders;
  }

  @Override
  public FolderMetadata snapshot(Path folder) throws IOException {
    if (!Files.isDirectory(folder)) {
      throw new NoSuchFileException(folder.toString());
    }

    List<String> files = new ArrayList<>();
    int audioFiles = 0;
    try (Stream<Path> walk = Files.walk(folder)) {
      for (Path file : (Iterable<Path>) walk.filter(Files::isRegularFile).sorted()::iterator) {
        files.add(folder.relativize(file).toString().replace('\\', '/'));
        if (isAudio(file)) {
          audioFiles++;
        }
      }
    }
    return new FolderMetadata(String.valueOf(folder.getFileName()), audioFiles, files);
  }

  @Override
  public FolderStructure structure(Path folder) throws IOException {
    List<Path> subdirectories = listSubdirectories(folder);
    int direct = 0;
    int total = 0;
    try (Stream<Path> walk = Files.walk(folder)) {
      for (Path file : (Iterable<Path>) walk.filter(Files::isRegularFile)::iterator) {
        if (isAudio(file)) {
          total++;
          if (folder.equals(file.getParent())) {
            direct++;
          }
        }
      }
    }
    return new FolderStructure(direct, total, subdirectories);
  }

  static boolean isAudio(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && AUDIO_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  private static boolean isHidden(Path entry) {
    return entry.getFileName().toString().startsWith(".");
  }
}
