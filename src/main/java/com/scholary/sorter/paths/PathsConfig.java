package com.scholary.sorter.paths;

/**
 * Immutable snapshot of the source/target roots: the active pair and the pending, possibly partial,
 * staged pair.
 */
public record PathsConfig(Roots current, Roots staged) {

  public PathsConfig {
    current = current == null ? Roots.EMPTY : current;
    staged = staged == null ? Roots.EMPTY : staged;
  }

  /** A source/target pair; either side may be {@code null}. */
  public record Roots(String sourceDir, String targetDir) {

    public static final Roots EMPTY = new Roots(null, null);

    public Roots withSourceDir(String value) {
      return new Roots(value, targetDir);
    }

    public Roots withTargetDir(String value) {
      return new Roots(sourceDir, value);
    }
  }
}
