package com.scholary.sorter.paths;

import com.scholary.sorter.paths.PathsConfig.Roots;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Owner of the source/target roots.
 *
 * <p>Changes go through two phases: {@link #stage} records a pending value without touching the
 * running pipeline, {@link #confirm} validates and promotes the staged pair in one step, {@link
 * #cancel} drops it. Readers get immutable {@link PathsConfig} snapshots, so they see either the
 * state before a confirm or the state after it.
 *
 * <p>Current roots are persisted in the store's settings table; staged roots live only in this
 * process.
 */
@Component
public class PathStagingManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(PathStagingManager.class);

  static final String SOURCE_KEY = "paths.source_dir";
  static final String TARGET_KEY = "paths.target_dir";

  private final SettingsRepository settings;
  private final PathsProperties defaults;
  private final ApplicationEventPublisher events;
  private final AtomicReference<PathsConfig> state;

  public PathStagingManager(
      SettingsRepository settings, PathsProperties defaults, ApplicationEventPublisher events) {
    this.settings = settings;
    this.defaults = defaults;
    this.events = events;
    this.state = new AtomicReference<>(new PathsConfig(loadCurrent(), Roots.EMPTY));
    LOGGER.info("Paths loaded: {}", state.get().current());
  }

  public PathsConfig snapshot() {
    return state.get();
  }

  /**
   * Stage a new source and/or target root. {@code null} leaves that side's staged value as it is.
   *
   * @throws ConfigurationException if a supplied value is unusable; nothing is staged then
   */
  public synchronized PathsConfig stage(String sourceDir, String targetDir) {
    if (sourceDir == null && targetDir == null) {
      throw new ConfigurationException("Nothing to stage: supply source_dir and/or target_dir");
    }
    String source = sourceDir == null ? null : validateSource(sourceDir);
    String target = targetDir == null ? null : validateTarget(targetDir);

    PathsConfig updated =
        state.updateAndGet(
            config -> {
              Roots staged = config.staged();
              if (source != null) {
                staged = staged.withSourceDir(source);
              }
              if (target != null) {
                staged = staged.withTargetDir(target);
              }
              return new PathsConfig(config.current(), staged);
            });
    LOGGER.info("Paths staged: {}", updated.staged());
    return updated;
  }

  /**
   * Promote the staged roots to current and clear the staged pair.
   *
   * @throws ConfigurationException if nothing is staged or the resulting pair is invalid; current
   *     and staged are left untouched then
   */
  public synchronized PathsConfig confirm() {
    PathsConfig before = state.get();
    Roots staged = before.staged();
    if (staged.sourceDir() == null && staged.targetDir() == null) {
      throw new ConfigurationException("Nothing staged to confirm");
    }

    Roots current = before.current();
    Roots next =
        new Roots(
            staged.sourceDir() != null ? staged.sourceDir() : current.sourceDir(),
            staged.targetDir() != null ? staged.targetDir() : current.targetDir());

    // values may have changed on disk since they were staged
    if (next.sourceDir() != null) {
      validateSource(next.sourceDir());
    }
    if (next.targetDir() != null) {
      validateTarget(next.targetDir());
    }
    validateCombination(next);
    if (next.targetDir() != null) {
      createTarget(next.targetDir());
    }

    Map<String, String> entries = new HashMap<>();
    entries.put(SOURCE_KEY, next.sourceDir());
    entries.put(TARGET_KEY, next.targetDir());
    settings.saveAll(entries);

    PathsConfig after = new PathsConfig(next, Roots.EMPTY);
    state.set(after);
    LOGGER.info("Paths confirmed: {} -> {}", current, next);
    events.publishEvent(new PathsConfirmedEvent(current, next));
    return after;
  }

  /** Discard the staged roots. */
  public synchronized PathsConfig cancel() {
    PathsConfig updated = state.updateAndGet(config -> new PathsConfig(config.current(), Roots.EMPTY));
    LOGGER.info("Staged paths discarded");
    return updated;
  }

  /** Reload the persisted current roots, picking up confirms made by other processes. */
  public synchronized PathsConfig refresh() {
    Roots persisted = loadCurrent();
    PathsConfig before = state.get();
    if (persisted.equals(before.current())) {
      return before;
    }
    PathsConfig updated = new PathsConfig(persisted, before.staged());
    state.set(updated);
    LOGGER.info("Paths changed by another process: {} -> {}", before.current(), persisted);
    return updated;
  }

  private Roots loadCurrent() {
    Map<String, String> persisted = settings.findAll();
    return new Roots(
        persisted.getOrDefault(SOURCE_KEY, blankToNull(defaults.sourceDir())),
        persisted.getOrDefault(TARGET_KEY, blankToNull(defaults.targetDir())));
  }

  private static String validateSource(String value) {
    Path source = normalize(value, "source_dir");
    if (!Files.exists(source)) {
      throw new ConfigurationException("Source directory does not exist: " + source);
    }
    if (!Files.isDirectory(source)) {
      throw new ConfigurationException("Source is not a directory: " + source);
    }
    if (!Files.isReadable(source)) {
      throw new ConfigurationException("Source directory is not readable: " + source);
    }
    return source.toString();
  }

  private static String validateTarget(String value) {
    Path target = normalize(value, "target_dir");
    if (Files.exists(target)) {
      if (!Files.isDirectory(target)) {
        throw new ConfigurationException("Target is not a directory: " + target);
      }
      if (!Files.isWritable(target)) {
        throw new ConfigurationException("Target directory is not writable: " + target);
      }
      return target.toString();
    }

    Path ancestor = target.getParent();
    while (ancestor != null && !Files.exists(ancestor)) {
      ancestor = ancestor.getParent();
    }
    if (ancestor == null || !Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
      throw new ConfigurationException("Target directory cannot be created: " + target);
    }
    return target.toString();
  }

  private static void validateCombination(Roots roots) {
    if (roots.sourceDir() == null || roots.targetDir() == null) {
      return;
    }
    Path source = Paths.get(roots.sourceDir());
    Path target = Paths.get(roots.targetDir());
    if (source.equals(target)) {
      throw new ConfigurationException("Source and target must differ: " + source);
    }
    if (target.startsWith(source)) {
      throw new ConfigurationException("Target must not lie inside the source: " + target);
    }
  }

  private static void createTarget(String targetDir) {
    try {
      Files.createDirectories(Paths.get(targetDir));
    } catch (IOException e) {
      throw new ConfigurationException(
          "Target directory cannot be created: " + targetDir + " (" + e.getMessage() + ")");
    }
  }

  private static Path normalize(String value, String field) {
    if (value.isBlank()) {
      throw new ConfigurationException(field + " must not be blank");
    }
    try {
      return Paths.get(value.trim()).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      throw new ConfigurationException("Invalid " + field + ": " + e.getMessage());
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
