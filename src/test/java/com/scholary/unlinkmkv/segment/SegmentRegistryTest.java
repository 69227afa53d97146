package com.scholary.unlinkmkv.segment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SegmentRegistryTest {

  @TempDir Path tempDir;

  @Test
  void resolve_shouldFindEntryByNormalizedId() {
    Path op = tempDir.resolve("op.mkv");
    SegmentRegistry registry =
        SegmentRegistry.of(List.of(new RegistryEntry("0xAB 0xCD", op, Timecode.ofSeconds(90))));

    assertThat(registry.resolve("abcd", null)).isPresent();
    assertThat(registry.resolve("ABCD", null).get().file()).isEqualTo(op.toAbsolutePath());
    assertThat(registry.resolve("ffff", null)).isEmpty();
  }

  @Test
  void resolve_shouldNeverReturnTheFileBeingProcessed() {
    Path episode = tempDir.resolve("episode.mkv");
    SegmentRegistry registry =
        SegmentRegistry.of(List.of(new RegistryEntry("01", episode, Timecode.ofSeconds(60))));

    assertThat(registry.resolve("01", episode)).isEmpty();
    assertThat(registry.resolve("01", tempDir.resolve("other.mkv"))).isPresent();
  }

  @Test
  void of_shouldRejectDuplicateIds() {
    List<RegistryEntry> entries =
        List.of(
            new RegistryEntry("0a", tempDir.resolve("a.mkv"), Timecode.ZERO),
            new RegistryEntry("0A", tempDir.resolve("b.mkv"), Timecode.ZERO));

    assertThatThrownBy(() -> SegmentRegistry.of(entries))
        .isInstanceOf(DuplicateSegmentException.class)
        .hasMessageContaining("0a");
  }

  @Test
  void durationOf_shouldReturnProbedDuration() {
    Path op = tempDir.resolve("op.mkv");
    SegmentRegistry registry =
        SegmentRegistry.of(List.of(new RegistryEntry("01", op, Timecode.ofSeconds(90))));

    assertThat(registry.durationOf(op)).contains(Timecode.ofSeconds(90));
    assertThat(registry.durationOf(tempDir.resolve("missing.mkv"))).isEmpty();
  }

  @Test
  void scan_shouldProbeOnlyMatroskaFiles() throws IOException {
    Files.createFile(tempDir.resolve("ep01.mkv"));
    Files.createFile(tempDir.resolve("op.MKV"));
    Files.createFile(tempDir.resolve("notes.txt"));
    Files.createDirectory(tempDir.resolve("nested.mkv"));
    Map<String, String> ids = Map.of("ep01.mkv", "01", "op.MKV", "02");

    SegmentRegistry registry =
        SegmentRegistry.scan(
            tempDir,
            file ->
                new SegmentProbe(
                    ids.get(file.getFileName().toString()), Timecode.ofSeconds(10)));

    assertThat(registry.size()).isEqualTo(2);
    assertThat(registry.resolve("02", null).get().file().getFileName().toString())
        .isEqualTo("op.MKV");
  }

  @Test
  void scan_shouldSkipFilesWithoutSegmentUid() throws IOException {
    Files.createFile(tempDir.resolve("a.mkv"));
    Files.createFile(tempDir.resolve("b.mkv"));

    SegmentRegistry registry =
        SegmentRegistry.scan(
            tempDir,
            file ->
                new SegmentProbe(
                    file.getFileName().toString().equals("a.mkv") ? "aa" : null, Timecode.ZERO));

    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void registryFor_shouldScanEachDirectoryOnce() throws IOException {
    Files.createFile(tempDir.resolve("a.mkv"));
    Files.createFile(tempDir.resolve("b.mkv"));
    AtomicInteger probes = new AtomicInteger();
    SegmentRegistryCache cache =
        new SegmentRegistryCache(
            file -> new SegmentProbe("0" + probes.incrementAndGet(), Timecode.ZERO), 8);

    SegmentRegistry first = cache.registryFor(tempDir.resolve("a.mkv"));
    SegmentRegistry second = cache.registryFor(tempDir.resolve("b.mkv"));

    assertThat(second).isSameAs(first);
    assertThat(probes.get()).isEqualTo(2);
  }
}
