package com.scholary.sorter.worker;

import com.scholary.sorter.filesystem.FolderInspector;
import com.scholary.sorter.filesystem.FolderStructure;
import com.scholary.sorter.job.FolderMetadata;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobType;
import com.scholary.sorter.logging.StructuredLogger;
import com.scholary.sorter.paths.PathStagingManager;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Enqueues a job for every folder under the source root that has never been tracked.
 *
 * <p>Folders whose earlier job is terminal are not picked up again. Folders without any audio file
 * are left alone. An artist collection, a folder holding only album sub-folders, is split into one
 * job per album carrying the collection's name as artist hint. A missing or unreadable source root
 * skips the cycle with a warning.
 */
@Component
public class ScanProducer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanProducer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobStore jobStore;
  private final FolderInspector inspector;
  private final PathStagingManager paths;
  private final Clock clock;

  public ScanProducer(
      JobStore jobStore, FolderInspector inspector, PathStagingManager paths, Clock clock) {
    this.jobStore = jobStore;
    this.inspector = inspector;
    this.paths = paths;
    this.clock = clock;
  }

  /** Run one scan cycle. Never throws for per-folder or enumeration failures. */
  public synchronized ScanReport scanOnce() {
    long start = clock.millis();
    String sourceDir = paths.refresh().current().sourceDir();
    if (sourceDir == null) {
      LOGGER.warn("Scan skipped: no source directory configured");
      return ScanReport.skipped(null, "No source directory configured");
    }

    List<Path> folders;
    try {
      folders = inspector.listSubdirectories(Paths.get(sourceDir));
    } catch (IOException e) {
      LOGGER.warn("Scan skipped: cannot list source {}: {}", sourceDir, e.toString());
      return ScanReport.skipped(sourceDir, "Cannot list source directory: " + e.getMessage());
    }

    Tally tally = new Tally();
    for (Path folder : folders) {
      String folderPath = folder.toString();
      try {
        if (jobStore.findLatestByFolder(folderPath).isPresent()) {
          tally.alreadyTracked++;
          continue;
        }
        FolderStructure structure = inspector.structure(folder);
        switch (structure.shape()) {
          case EMPTY -> {
            tally.ignored++;
            LOGGER.debug("No audio files in {}; not enqueued", folderPath);
          }
          case ARTIST_COLLECTION -> enqueueCollection(folder, structure, tally);
          default -> enqueue(folder, inspector.snapshot(folder), null, tally);
        }
      } catch (IOException | DataAccessException e) {
        tally.failed++;
        LOGGER.warn("Could not enqueue {}: {}", folderPath, e.getMessage());
      }
    }

    structuredLogger.logScanCompleted(
        sourceDir, tally.discovered, tally.alreadyTracked, clock.millis() - start);
    return new ScanReport(
        sourceDir, tally.discovered, tally.alreadyTracked, tally.ignored, tally.failed, null);
  }

  /** One job per album sub-folder, hinted with the collection folder's name as the artist. */
  private void enqueueCollection(Path collection, FolderStructure structure, Tally tally) {
    String artistHint = String.valueOf(collection.getFileName());
    LOGGER.info(
        "Splitting artist collection {} into {} album folders",
        collection,
        structure.subdirectories().size());
    for (Path album : structure.subdirectories()) {
      String albumPath = album.toString();
      try {
        if (jobStore.findLatestByFolder(albumPath).isPresent()) {
          tally.alreadyTracked++;
          continue;
        }
        FolderMetadata metadata = inspector.snapshot(album);
        if (metadata.totalFiles() == 0) {
          tally.ignored++;
          continue;
        }
        enqueue(album, metadata, artistHint, tally);
      } catch (IOException | DataAccessException e) {
        tally.failed++;
        LOGGER.warn("Could not enqueue {}: {}", albumPath, e.getMessage());
      }
    }
  }

  private void enqueue(Path folder, FolderMetadata metadata, String artistHint, Tally tally) {
    if (jobStore.create(folder.toString(), JobType.SCAN_DISCOVERED, metadata, artistHint)
        .isPresent()) {
      tally.discovered++;
    } else {
      tally.alreadyTracked++;
    }
  }

  private static final class Tally {
    int discovered;
    int alreadyTracked;
    int ignored;
    int failed;
  }
}
