package com.scholary.unlinkmkv.segment;

import com.scholary.unlinkmkv.chapter.SegmentUid;
import com.scholary.unlinkmkv.timecode.Timecode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps segment UIDs to the sibling files that provide them.
 *
 * <p>Built once per directory by probing every {@code .mkv} file in it and immutable afterwards,
 * so one instance can serve every linked file of that directory.
 */
public final class SegmentRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentRegistry.class);

  private final Map<String, RegistryEntry> entries;
  private final Map<Path, RegistryEntry> byFile;

  private SegmentRegistry(Map<String, RegistryEntry> entries) {
    this.entries = Map.copyOf(entries);
    this.byFile =
        entries.values().stream()
            .collect(Collectors.toUnmodifiableMap(entry -> entry.file(), entry -> entry));
  }

  /**
   * Build a registry from already probed entries.
   *
   * @throws DuplicateSegmentException if two entries share an id
   */
  public static SegmentRegistry of(Collection<RegistryEntry> entries) {
    Map<String, RegistryEntry> map = new LinkedHashMap<>();
    for (RegistryEntry entry : entries) {
      RegistryEntry normalized =
          new RegistryEntry(
              SegmentUid.normalizeHex(entry.id()),
              entry.file().toAbsolutePath().normalize(),
              entry.duration());
      RegistryEntry previous = map.putIfAbsent(normalized.id(), normalized);
      if (previous != null) {
        throw new DuplicateSegmentException(normalized.id(), previous.file(), normalized.file());
      }
    }
    return new SegmentRegistry(map);
  }

  /**
   * Probe every Matroska file in a directory.
   *
   * @param directory directory to scan (not recursive)
   * @param prober collaborator reading each file's segment UID and duration
   * @return the registry
   * @throws IOException if the directory cannot be listed
   * @throws DuplicateSegmentException if two files share a segment UID
   */
  public static SegmentRegistry scan(Path directory, SegmentProber prober) throws IOException {
    LOGGER.info("Scanning {} for segment files", directory);

    List<Path> files;
    try (Stream<Path> listing = Files.list(directory)) {
      files =
          listing
              .filter(Files::isRegularFile)
              .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".mkv"))
              .sorted()
              .toList();
    }

    List<RegistryEntry> probed =
        files.stream()
            .map(
                file -> {
                  SegmentProbe probe = prober.probeSegment(file);
                  LOGGER.debug(
                      "Probed {}: segment={}, duration={}",
                      file.getFileName(),
                      probe.segmentId(),
                      probe.duration());
                  return probe.segmentId() == null
                      ? null
                      : new RegistryEntry(probe.segmentId(), file, probe.duration());
                })
            .filter(Objects::nonNull)
            .toList();

    SegmentRegistry registry = of(probed);
    LOGGER.info("Registered {} segments from {}", registry.size(), directory);
    return registry;
  }

  /**
   * Look up the file providing a segment.
   *
   * @param segmentId normalized segment UID
   * @param currentFile the file being processed; never returned, even if it owns the id
   * @return the providing entry, or empty if none (or only the current file) provides it
   */
  public Optional<RegistryEntry> resolve(String segmentId, Path currentFile) {
    RegistryEntry entry = entries.get(SegmentUid.normalizeHex(segmentId));
    if (entry == null) {
      return Optional.empty();
    }
    if (currentFile != null && entry.file().equals(currentFile.toAbsolutePath().normalize())) {
      LOGGER.debug("Segment {} refers to the file being processed, ignoring", segmentId);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  /** Duration of a registered file, if it was probed. */
  public Optional<Timecode> durationOf(Path file) {
    return Optional.ofNullable(byFile.get(file.toAbsolutePath().normalize()))
        .map(RegistryEntry::duration);
  }

  public int size() {
    return entries.size();
  }
}
