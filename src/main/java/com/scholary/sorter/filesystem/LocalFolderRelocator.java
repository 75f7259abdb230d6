package com.scholary.sorter.filesystem;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * {@link FolderRelocator} over the local filesystem.
 *
 * <p>Tries an atomic rename first. When source and destination live on different file stores it
 * copies into a hidden staging directory next to the destination, renames the staging directory
 * into place, and only then deletes the source. A failure before that rename removes the staging
 * copy and leaves the source as it was.
 *
 * <p>The copy runs on the relocation pool and the caller waits at most the move timeout for it. A
 * copy that is still running at that point is abandoned: it can no longer swap into place.
 */
@Component
public class LocalFolderRelocator implements FolderRelocator {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFolderRelocator.class);

  static final String STAGING_PREFIX = ".staging-";

  private final Clock clock;
  private final ThreadPoolTaskExecutor relocationExecutor;

  public LocalFolderRelocator(
      Clock clock, @Qualifier("relocationExecutor") ThreadPoolTaskExecutor relocationExecutor) {
    this.clock = clock;
    this.relocationExecutor = relocationExecutor;
  }

  @Override
  public void relocate(Path source, Path destination, Duration timeout) {
    if (!Files.isDirectory(source)) {
      throw new RelocationException("Source folder no longer exists: " + source);
    }
    if (Files.exists(destination)) {
      throw new RelocationException("Destination already exists: " + destination);
    }

    try {
      Files.createDirectories(destination.getParent());
    } catch (IOException e) {
      throw new RelocationException("Cannot create destination parent: " + destination.getParent(), e);
    }

    try {
      Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
      LOGGER.info("Moved {} -> {} (rename)", source, destination);
      return;
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.debug("Atomic rename not possible for {}, falling back to copy", source);
    } catch (IOException e) {
      throw new RelocationException("Move failed: " + e.getMessage(), e);
    }

    copyWithDeadline(source, destination, timeout);
  }

  /** Copy-then-swap on the relocation pool, waiting no longer than {@code timeout}. */
  void copyWithDeadline(Path source, Path destination, Duration timeout) {
    StagedCopy copy = new StagedCopy(source, destination, clock.instant().plus(timeout));
    Future<?> future;
    try {
      future = relocationExecutor.getThreadPoolExecutor().submit(copy::run);
    } catch (RejectedExecutionException e) {
      throw new RelocationException("Relocation pool is saturated", e);
    }

    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      if (!copy.abandon()) {
        // swapped in just as the wait ran out; the move itself succeeded
        LOGGER.info("Moved {} -> {} (copy, at the deadline)", source, destination);
        return;
      }
      future.cancel(true);
      throw new RelocationException(
          "Move timed out after " + timeout.toSeconds() + "s while copying " + source, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RelocationException relocationException) {
        throw relocationException;
      }
      throw new RelocationException("Copy failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      copy.abandon();
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new RelocationException("Interrupted while moving " + source, e);
    }
  }

  /** Copies a single file into the staging tree. */
  void copyFile(Path from, Path to) throws IOException {
    Files.copy(from, to, StandardCopyOption.COPY_ATTRIBUTES);
  }

  private final class StagedCopy {

    private final Path source;
    private final Path destination;
    private final Path staging;
    private final Instant deadline;
    private boolean abandoned;
    private boolean swapped;

    StagedCopy(Path source, Path destination, Instant deadline) {
      this.source = source;
      this.destination = destination;
      this.staging = destination.resolveSibling(STAGING_PREFIX + UUID.randomUUID());
      this.deadline = deadline;
    }

    void run() {
      try {
        copyTree();
        swap();
      } catch (IOException | RelocationException e) {
        discard(staging);
        if (e instanceof RelocationException relocationException) {
          throw relocationException;
        }
        throw new RelocationException("Copy failed: " + e.getMessage(), e);
      }

      // the folder is complete at the destination from here on
      try {
        deleteTree(source);
        LOGGER.info("Moved {} -> {} (copy)", source, destination);
      } catch (IOException e) {
        LOGGER.warn(
            "Moved {} -> {} but could not fully remove the source: {}",
            source,
            destination,
            e.getMessage());
      }
    }

    /** Returns false when the copy has already swapped into place. */
    synchronized boolean abandon() {
      if (swapped) {
        return false;
      }
      abandoned = true;
      return true;
    }

    private synchronized void swap() throws IOException {
      if (abandoned) {
        throw new RelocationException("Move of " + source + " was abandoned");
      }
      Files.move(staging, destination, StandardCopyOption.ATOMIC_MOVE);
      swapped = true;
    }

    private synchronized boolean isAbandoned() {
      return abandoned;
    }

    private void checkStillWanted() {
      if (isAbandoned() || Thread.currentThread().isInterrupted()) {
        throw new RelocationException("Move of " + source + " was abandoned");
      }
      if (clock.instant().isAfter(deadline)) {
        throw new RelocationException("Move timed out while copying " + source);
      }
    }

    private void copyTree() throws IOException {
      Files.walkFileTree(
          source,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                throws IOException {
              Files.createDirectories(staging.resolve(source.relativize(dir).toString()));
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                throws IOException {
              checkStillWanted();
              copyFile(file, staging.resolve(source.relativize(file).toString()));
              return FileVisitResult.CONTINUE;
            }
          });
    }
  }

  private void discard(Path staging) {
    if (!Files.exists(staging)) {
      return;
    }
    try {
      deleteTree(staging);
    } catch (IOException e) {
      LOGGER.warn("Could not remove staging copy {}: {}", staging, e.getMessage());
    }
  }

  static void deleteTree(Path root) throws IOException {
    try (Stream<Path> walk = Files.walk(root)) {
      for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
        Files.delete(path);
      }
    }
  }
}
