package com.scholary.sorter.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.sorter.filesystem.FolderInspector;
import com.scholary.sorter.filesystem.FolderStructure;
import com.scholary.sorter.job.FolderMetadata;
import com.scholary.sorter.job.Job;
import com.scholary.sorter.job.JobStatus;
import com.scholary.sorter.job.JobStore;
import com.scholary.sorter.job.JobType;
import com.scholary.sorter.paths.PathStagingManager;
import com.scholary.sorter.paths.PathsConfig;
import com.scholary.sorter.paths.PathsConfig.Roots;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

/** Tests for ScanProducer with a mocked store and filesystem. */
@ExtendWith(MockitoExtension.class)
class ScanProducerTest {

  private static final Path SOURCE = Paths.get("/music");

  @Mock private JobStore jobStore;
  @Mock private FolderInspector inspector;
  @Mock private PathStagingManager paths;

  private ScanProducer producer;

  @BeforeEach
  void setUp() {
    producer = new ScanProducer(jobStore, inspector, paths, Clock.systemUTC());
  }

  @Test
  void scanOnce_shouldEnqueueOnlyUntrackedFolders() throws Exception {
    configuredSource("/music");
    Path a = SOURCE.resolve("A");
    Path b = SOURCE.resolve("B");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(a, b));
    when(jobStore.findLatestByFolder("/music/A")).thenReturn(Optional.of(job("/music/A")));
    when(jobStore.findLatestByFolder("/music/B")).thenReturn(Optional.empty());
    FolderMetadata metadata = new FolderMetadata("B", 3, List.of("1.mp3", "2.mp3", "3.mp3"));
    album(b);
    when(inspector.snapshot(b)).thenReturn(metadata);
    when(jobStore.create("/music/B", JobType.SCAN_DISCOVERED, metadata, null))
        .thenReturn(Optional.of(job("/music/B")));

    ScanReport report = producer.scanOnce();

    assertThat(report.ok()).isTrue();
    assertThat(report.discovered()).isEqualTo(1);
    assertThat(report.alreadyTracked()).isEqualTo(1);
    verify(jobStore, never()).create(eq("/music/A"), any(), any(), any());
  }

  @Test
  void scanOnce_shouldBeIdempotentOnRescan() throws Exception {
    configuredSource("/music");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(SOURCE.resolve("A")));
    when(jobStore.findLatestByFolder("/music/A")).thenReturn(Optional.of(job("/music/A")));

    ScanReport first = producer.scanOnce();
    ScanReport second = producer.scanOnce();

    assertThat(first.discovered()).isZero();
    assertThat(second.discovered()).isZero();
    verify(jobStore, never()).create(anyString(), any(), any(), any());
  }

  @Test
  void scanOnce_shouldCountALostCreateRaceAsTracked() throws Exception {
    configuredSource("/music");
    Path a = SOURCE.resolve("A");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(a));
    when(jobStore.findLatestByFolder("/music/A")).thenReturn(Optional.empty());
    album(a);
    when(inspector.snapshot(a)).thenReturn(FolderMetadata.named("A"));
    when(jobStore.create(eq("/music/A"), any(), any(), any())).thenReturn(Optional.empty());

    ScanReport report = producer.scanOnce();

    assertThat(report.discovered()).isZero();
    assertThat(report.alreadyTracked()).isEqualTo(1);
  }

  @Test
  void scanOnce_shouldSkipTheCycleForAMissingSource() throws Exception {
    configuredSource("/music");
    when(inspector.listSubdirectories(SOURCE)).thenThrow(new NoSuchFileException("/music"));

    ScanReport report = producer.scanOnce();

    assertThat(report.ok()).isFalse();
    assertThat(report.error()).contains("Cannot list source directory");
    verify(jobStore, never()).create(anyString(), any(), any(), any());
  }

  @Test
  void scanOnce_shouldSkipTheCycleWithoutASource() throws IOException {
    when(paths.refresh()).thenReturn(new PathsConfig(Roots.EMPTY, Roots.EMPTY));

    ScanReport report = producer.scanOnce();

    assertThat(report.ok()).isFalse();
    verify(inspector, never()).listSubdirectories(any());
  }

  @Test
  void scanOnce_shouldKeepGoingPastOneBadFolder() throws Exception {
    configuredSource("/music");
    Path a = SOURCE.resolve("A");
    Path b = SOURCE.resolve("B");
    Path c = SOURCE.resolve("C");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(a, b, c));
    when(jobStore.findLatestByFolder(anyString())).thenReturn(Optional.empty());
    when(inspector.structure(a)).thenThrow(new AccessDeniedException("/music/A"));
    album(b);
    album(c);
    when(inspector.snapshot(b)).thenReturn(FolderMetadata.named("B"));
    when(inspector.snapshot(c)).thenReturn(FolderMetadata.named("C"));
    when(jobStore.create(eq("/music/B"), any(), any(), any()))
        .thenThrow(new DataAccessResourceFailureException("database is locked"));
    when(jobStore.create(eq("/music/C"), any(), any(), any()))
        .thenReturn(Optional.of(job("/music/C")));

    ScanReport report = producer.scanOnce();

    assertThat(report.ok()).isTrue();
    assertThat(report.failed()).isEqualTo(2);
    assertThat(report.discovered()).isEqualTo(1);
  }

  @Test
  void scanOnce_shouldSplitAnArtistCollectionIntoHintedAlbumJobs() throws Exception {
    configuredSource("/music");
    Path artist = SOURCE.resolve("Artist");
    Path first = artist.resolve("1999 - First");
    Path second = artist.resolve("2003 - Second");
    Path scans = artist.resolve("Scans");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(artist));
    when(jobStore.findLatestByFolder(anyString())).thenReturn(Optional.empty());
    when(jobStore.findLatestByFolder("/music/Artist/2003 - Second"))
        .thenReturn(Optional.of(job("/music/Artist/2003 - Second")));
    when(inspector.structure(artist))
        .thenReturn(new FolderStructure(0, 12, List.of(first, second, scans)));
    FolderMetadata firstMetadata = new FolderMetadata("1999 - First", 10, List.of("01.mp3"));
    when(inspector.snapshot(first)).thenReturn(firstMetadata);
    when(inspector.snapshot(scans)).thenReturn(new FolderMetadata("Scans", 0, List.of("a.jpg")));
    when(jobStore.create(
            "/music/Artist/1999 - First", JobType.SCAN_DISCOVERED, firstMetadata, "Artist"))
        .thenReturn(Optional.of(job("/music/Artist/1999 - First")));

    ScanReport report = producer.scanOnce();

    assertThat(report.discovered()).isEqualTo(1);
    assertThat(report.alreadyTracked()).isEqualTo(1);
    assertThat(report.ignored()).isEqualTo(1);
    verify(jobStore, never()).create(eq("/music/Artist"), any(), any(), any());
    verify(jobStore, never()).create(eq("/music/Artist/Scans"), any(), any(), any());
  }

  @Test
  void scanOnce_shouldEnqueueAMultiDiscAlbumAsOneJob() throws Exception {
    configuredSource("/music");
    Path album = SOURCE.resolve("Box Set");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(album));
    when(jobStore.findLatestByFolder("/music/Box Set")).thenReturn(Optional.empty());
    when(inspector.structure(album))
        .thenReturn(
            new FolderStructure(0, 20, List.of(album.resolve("CD1"), album.resolve("CD2"))));
    FolderMetadata metadata = new FolderMetadata("Box Set", 20, List.of("CD1/01.mp3"));
    when(inspector.snapshot(album)).thenReturn(metadata);
    when(jobStore.create("/music/Box Set", JobType.SCAN_DISCOVERED, metadata, null))
        .thenReturn(Optional.of(job("/music/Box Set")));

    ScanReport report = producer.scanOnce();

    assertThat(report.discovered()).isEqualTo(1);
    verify(inspector, never()).snapshot(album.resolve("CD1"));
  }

  @Test
  void scanOnce_shouldLeaveFoldersWithoutAudioAlone() throws Exception {
    configuredSource("/music");
    Path scans = SOURCE.resolve("Scans");
    when(inspector.listSubdirectories(SOURCE)).thenReturn(List.of(scans));
    when(jobStore.findLatestByFolder("/music/Scans")).thenReturn(Optional.empty());
    when(inspector.structure(scans)).thenReturn(new FolderStructure(0, 0, List.of()));

    ScanReport report = producer.scanOnce();

    assertThat(report.ignored()).isEqualTo(1);
    assertThat(report.discovered()).isZero();
    verify(jobStore, never()).create(anyString(), any(), any(), any());
  }

  private void album(Path folder) throws IOException {
    when(inspector.structure(folder)).thenReturn(new FolderStructure(3, 3, List.of()));
  }

  private void configuredSource(String sourceDir) {
    when(paths.refresh()).thenReturn(new PathsConfig(new Roots(sourceDir, "/library"), null));
  }

  private static Job job(String folderPath) {
    return new Job(
        1L,
        folderPath,
        JobType.SCAN_DISCOVERED,
        JobStatus.QUEUED,
        FolderMetadata.named("x"),
        null,
        null,
        null,
        null,
        null,
        1L,
        Instant.EPOCH,
        Instant.EPOCH);
  }
}
