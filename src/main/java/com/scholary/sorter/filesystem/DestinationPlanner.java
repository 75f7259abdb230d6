package com.scholary.sorter.filesystem;

import com.scholary.sorter.job.Proposal;
import java.nio.file.Path;

/**
 * Computes where an accepted folder ends up: {@code target/Artist/Album (Year)}.
 *
 * <p>Missing fields fall back to "Unknown Artist", "Unknown Album" and "Unknown".
 */
public final class DestinationPlanner {

  static final String UNKNOWN_ARTIST = "Unknown Artist";
  static final String UNKNOWN_ALBUM = "Unknown Album";
  static final String UNKNOWN_YEAR = "Unknown";
  static final int MAX_SEGMENT_LENGTH = 120;

  private static final String INVALID_CHARS = "<>:\"/\\|?*";

  private DestinationPlanner() {}

  public static Path destinationFor(Path targetRoot, Proposal proposal) {
    Proposal p = proposal == null ? Proposal.empty() : proposal;
    String artist = sanitize(p.artist(), UNKNOWN_ARTIST);
    String album = sanitize(p.album(), UNKNOWN_ALBUM);
    String year = sanitize(p.year(), UNKNOWN_YEAR);
    return targetRoot.resolve(artist).resolve(album + " (" + year + ")");
  }

  /** Make a value safe to use as a single path segment. */
  static String sanitize(String value, String fallback) {
    if (value == null) {
      return fallback;
    }
    StringBuilder out = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      out.append(INVALID_CHARS.indexOf(c) >= 0 || Character.isISOControl(c) ? '_' : c);
    }
    String segment = out.toString().trim();
    if (segment.length() > MAX_SEGMENT_LENGTH) {
      segment = segment.substring(0, MAX_SEGMENT_LENGTH).trim();
    }
    // never let a segment walk out of its parent
    if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
      return fallback;
    }
    return segment;
  }
}
