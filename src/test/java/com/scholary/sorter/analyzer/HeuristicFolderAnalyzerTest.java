package com.scholary.sorter.analyzer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.sorter.job.FolderMetadata;
import com.scholary.sorter.job.Proposal;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeuristicFolderAnalyzerTest {

  private final HeuristicFolderAnalyzer analyzer = new HeuristicFolderAnalyzer();

  @Test
  void analyze_shouldReadYearDashAlbum() {
    Proposal proposal = analyze("2001 - Discovery", null, null);

    assertThat(proposal.year()).isEqualTo("2001");
    assertThat(proposal.album()).isEqualTo("Discovery");
    assertThat(proposal.artist()).isNull();
    assertThat(proposal.confidence()).isEqualTo("low");
  }

  @Test
  void analyze_shouldReadArtistYearAlbum() {
    Proposal proposal = analyze("Daft Punk - 2001 - Discovery", null, null);

    assertThat(proposal.artist()).isEqualTo("Daft Punk");
    assertThat(proposal.year()).isEqualTo("2001");
    assertThat(proposal.album()).isEqualTo("Discovery");
  }

  @Test
  void analyze_shouldReadArtistAlbumWithYearSuffix() {
    Proposal proposal = analyze("Daft Punk - Homework (1997)", null, null);

    assertThat(proposal.artist()).isEqualTo("Daft Punk");
    assertThat(proposal.album()).isEqualTo("Homework");
    assertThat(proposal.year()).isEqualTo("1997");
  }

  @Test
  void analyze_shouldFillTheArtistFromTheHint() {
    Proposal proposal = analyze("Random Access Memories", null, "Daft Punk");

    assertThat(proposal.album()).isEqualTo("Random Access Memories");
    assertThat(proposal.artist()).isEqualTo("Daft Punk");
    assertThat(proposal.year()).isNull();
    assertThat(proposal.isBlank()).isFalse();
  }

  @Test
  void analyze_shouldCarryFeedbackIntoReasoning() {
    Proposal proposal = analyze("Discovery", "it is by Daft Punk", null);

    assertThat(proposal.reasoning()).contains("it is by Daft Punk");
  }

  @Test
  void analyze_shouldFallBackToThePathWithoutAName() {
    Proposal proposal =
        analyzer.analyze(new AnalysisRequest("/music/1999 - Midnight Vultures", null, null, null));

    assertThat(proposal.album()).isEqualTo("Midnight Vultures");
    assertThat(proposal.year()).isEqualTo("1999");
  }

  @Test
  void analyze_shouldRefuseWithoutAnyName() {
    assertThatThrownBy(() -> analyzer.analyze(new AnalysisRequest(null, null, null, null)))
        .isInstanceOf(AnalyzerException.class);
  }

  private Proposal analyze(String folderName, String feedback, String artistHint) {
    FolderMetadata metadata = new FolderMetadata(folderName, 1, List.of("01.flac"));
    return analyzer.analyze(
        new AnalysisRequest("/music/" + folderName, metadata, feedback, artistHint));
  }
}
