package com.scholary.sorter.analyzer;

import com.scholary.sorter.job.Proposal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline analyzer that reads a proposal straight out of the folder name.
 *
 * <p>Understands the common layouts {@code Artist - 2001 - Album}, {@code 2001 - Album}, {@code
 * Artist - Album (2001)} and {@code Artist - Album}. Anything it cannot place becomes the album
 * title. Every proposal it makes is marked {@code low} confidence.
 */
public class HeuristicFolderAnalyzer implements FolderAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HeuristicFolderAnalyzer.class);

  static final String CONFIDENCE = "low";

  private static final String YEAR = "((?:19|20)\\d{2})";
  private static final Pattern ARTIST_YEAR_ALBUM =
      Pattern.compile("^(.+?)\\s+-\\s+" + YEAR + "\\s+-\\s+(.+)$");
  private static final Pattern YEAR_ALBUM = Pattern.compile("^" + YEAR + "\\s*-\\s*(.+)$");
  private static final Pattern ALBUM_YEAR_SUFFIX =
      Pattern.compile("^(.+?)\\s*[(\\[]" + YEAR + "[)\\]]$");
  private static final Pattern ARTIST_ALBUM = Pattern.compile("^(.+?)\\s+-\\s+(.+)$");

  @Override
  public Proposal analyze(AnalysisRequest request) {
    String name = folderName(request);
    if (name == null || name.isBlank()) {
      throw new AnalyzerException("Cannot derive a proposal without a folder name");
    }

    String artist = null;
    String album;
    String year = null;
    String reasoning;

    Matcher m;
    if ((m = ARTIST_YEAR_ALBUM.matcher(name)).matches()) {
      artist = m.group(1);
      year = m.group(2);
      album = m.group(3);
      reasoning = "Folder name matches 'Artist - Year - Album'";
    } else if ((m = YEAR_ALBUM.matcher(name)).matches()) {
      year = m.group(1);
      album = m.group(2);
      reasoning = "Folder name matches 'Year - Album'";
    } else {
      album = name;
      reasoning = "Folder name used as album title";
      if ((m = ALBUM_YEAR_SUFFIX.matcher(album)).matches()) {
        album = m.group(1);
        year = m.group(2);
      }
      if ((m = ARTIST_ALBUM.matcher(album)).matches()) {
        artist = m.group(1);
        album = m.group(2);
        reasoning = "Folder name matches 'Artist - Album'";
      }
    }

    if (artist == null && request.artistHint() != null && !request.artistHint().isBlank()) {
      artist = request.artistHint();
      reasoning += "; artist taken from hint";
    }
    if (request.feedback() != null && !request.feedback().isBlank()) {
      reasoning += "; reviewer feedback noted: " + request.feedback();
    }

    Proposal proposal =
        new Proposal(trim(artist), trim(album), year, "album", CONFIDENCE, reasoning);
    LOGGER.debug("Heuristic proposal for {}: {}", name, proposal);
    return proposal;
  }

  private static String folderName(AnalysisRequest request) {
    if (request.metadata() != null && request.metadata().folderName() != null) {
      return request.metadata().folderName().trim();
    }
    if (request.folderPath() == null) {
      return null;
    }
    Path fileName = Paths.get(request.folderPath()).getFileName();
    return fileName == null ? null : fileName.toString().trim();
  }

  private static String trim(String value) {
    return value == null ? null : value.trim();
  }
}
