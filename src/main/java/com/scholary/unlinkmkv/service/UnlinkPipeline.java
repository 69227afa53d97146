package com.scholary.unlinkmkv.service;

import com.scholary.unlinkmkv.UnlinkException;
import com.scholary.unlinkmkv.chapter.ChapterDocument;
import com.scholary.unlinkmkv.config.UnlinkProperties;
import com.scholary.unlinkmkv.segment.SegmentRegistry;
import com.scholary.unlinkmkv.segment.SegmentRegistryCache;
import com.scholary.unlinkmkv.subtitle.StyleUnifier;
import com.scholary.unlinkmkv.timeline.Part;
import com.scholary.unlinkmkv.timeline.PartAssembler;
import com.scholary.unlinkmkv.timeline.TimelineBuilder;
import com.scholary.unlinkmkv.timeline.TimelinePlan;
import com.scholary.unlinkmkv.timeline.TimelineSegment;
import com.scholary.unlinkmkv.toolchain.MetadataEdit;
import com.scholary.unlinkmkv.toolchain.SubtitleTrack;
import com.scholary.unlinkmkv.toolchain.Toolchain;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Unlinks a single file.
 *
 * <p>Phases:
 *
 * <ol>
 *   <li>Read the chapters; files without segment references are skipped
 *   <li>Flatten the chosen edition into a timeline and plan split points
 *   <li>Collect attachments of every file on the timeline
 *   <li>Split the file and assign the parts to append
 *   <li>Unify subtitle styles across all parts and remux the rewritten scripts
 *   <li>Append the parts with the flattened chapters, restore metadata, move to the output folder
 * </ol>
 *
 * <p>All intermediate files live in a per-call {@link Workspace}.
 */
@Service
public class UnlinkPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(UnlinkPipeline.class);

  private final Toolchain toolchain;
  private final TimelineBuilder timelineBuilder;
  private final PartAssembler partAssembler;
  private final StyleUnifier styleUnifier;
  private final UnlinkProperties properties;

  public UnlinkPipeline(
      Toolchain toolchain,
      TimelineBuilder timelineBuilder,
      PartAssembler partAssembler,
      StyleUnifier styleUnifier,
      UnlinkProperties properties) {
    this.toolchain = toolchain;
    this.timelineBuilder = timelineBuilder;
    this.partAssembler = partAssembler;
    this.styleUnifier = styleUnifier;
    this.properties = properties;
  }

  /**
   * Unlink one file into the output directory.
   *
   * @param file the linked file
   * @param registries segment registries of the current batch
   * @return SUCCEEDED with the output path, or SKIPPED if the file is not linked
   * @throws IOException if reading or writing files fails
   * @throws UnlinkException if the chapters cannot be reconstructed or a tool fails
   */
  public FileResult process(Path file, SegmentRegistryCache registries) throws IOException {
    LOGGER.info("Checking if {} is segmented", file.getFileName());
    String chapterXml = toolchain.readChapters(file);
    if (!ChapterDocument.isLinked(chapterXml)) {
      LOGGER.info("{} does not contain segmented chapters", file.getFileName());
      return FileResult.skipped(file, "File does not contain segmented chapters");
    }

    Path destination = Paths.get(properties.outDir()).resolve(file.getFileName());
    if (destination.toAbsolutePath().normalize().equals(file.toAbsolutePath().normalize())) {
      throw new UnlinkException("Output directory holds the input file " + file.getFileName());
    }

    Workspace workspace = Workspace.create(Paths.get(properties.tmpDir()));
    LOGGER.debug("Working in {}", workspace.root());
    try {
      Path output = unlink(file, chapterXml, registries, workspace, destination);
      return FileResult.succeeded(file, output);
    } finally {
      if (properties.cleanup()) {
        deleteWorkspace(workspace);
      } else {
        LOGGER.info("Keeping intermediate files in {}", workspace.root());
      }
    }
  }

  /**
   * Plan one file without writing any media.
   *
   * @return the plan, or empty if the file is not linked
   */
  public Optional<TimelinePreview> preview(Path file, SegmentRegistryCache registries)
      throws IOException {
    String chapterXml = toolchain.readChapters(file);
    if (!ChapterDocument.isLinked(chapterXml)) {
      return Optional.empty();
    }
    TimelinePlan plan = plan(file, chapterXml, registries.registryFor(file));
    return Optional.of(
        new TimelinePreview(plan, partAssembler.assemble(plan, properties.ignoreSegmentStart())));
  }

  private Path unlink(
      Path file,
      String chapterXml,
      SegmentRegistryCache registries,
      Workspace workspace,
      Path destination)
      throws IOException {

    String stem = stem(file);
    Files.writeString(workspace.root().resolve(stem + "-chapters-original.xml"), chapterXml);

    // Phase 1: timeline
    TimelinePlan plan = plan(file, chapterXml, registries.registryFor(file));
    Path chapterFile = workspace.root().resolve(stem + "-chapters.xml");
    Files.write(chapterFile, plan.chapters().serialize());

    LOGGER.info("Reading metadata");
    List<MetadataEdit> metadata = toolchain.probeMetadata(file);

    // Phase 2: attachments
    LOGGER.info("Searching attachments");
    Set<Path> timelineFiles = new LinkedHashSet<>();
    plan.segments().stream().map(TimelineSegment::file).forEach(timelineFiles::add);
    for (Path timelineFile : timelineFiles) {
      toolchain.extractAttachments(timelineFile, workspace.attachments());
    }
    List<Path> attachments = listFiles(workspace.attachments());

    // Phase 3: parts
    List<Path> slices =
        plan.requiresSplit()
            ? toolchain.splitFile(file, plan.splitPoints(), workspace.parts())
            : List.of();
    List<Path> parts = new ArrayList<>();
    for (Part part : partAssembler.assemble(plan, properties.ignoreSegmentStart())) {
      parts.add(part.resolve(slices));
    }
    if (parts.isEmpty()) {
      throw new UnlinkException("No parts left to build " + file.getFileName());
    }

    // Phase 4: subtitles
    if (properties.subtitles().fix()) {
      parts = fixSubtitles(parts, attachments, workspace);
    }

    // Phase 5: build
    LOGGER.info("Building file from {} parts", parts.size());
    Path built = workspace.encodes().resolve(file.getFileName());
    toolchain.muxParts(parts, properties.chapters() ? chapterFile : null, attachments, built);

    if (!metadata.isEmpty()) {
      LOGGER.info("Applying metadata");
      toolchain.applyMetadata(built, metadata);
    }

    Files.createDirectories(destination.getParent());
    Files.move(built, destination, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.info("Output written to {}", destination);
    return destination;
  }

  private TimelinePlan plan(Path file, String chapterXml, SegmentRegistry registry) {
    ChapterDocument chapters = ChapterDocument.parse(chapterXml);
    if (!properties.keepNonDefaultEditions()) {
      int dropped = chapters.dropNonDefaultEditions();
      if (dropped > 0) {
        LOGGER.info("Removed {} non-default editions", dropped);
      }
    }
    return timelineBuilder.build(chapters, properties.edition(), registry, file);
  }

  /**
   * Extract the subtitle tracks of every distinct part, unify their styles and remux them.
   *
   * @return the parts, with remuxed files in place of those that had subtitles
   */
  private List<Path> fixSubtitles(List<Path> parts, List<Path> attachments, Workspace workspace)
      throws IOException {
    LOGGER.info("Extracting subtitles");
    Map<Path, List<SubtitleTrack>> tracksByPart = new LinkedHashMap<>();
    for (Path part : new LinkedHashSet<>(parts)) {
      List<SubtitleTrack> tracks = toolchain.extractSubtitleTracks(part, workspace.subtitles());
      if (!tracks.isEmpty()) {
        tracksByPart.put(part, tracks);
      }
    }
    if (tracksByPart.isEmpty()) {
      LOGGER.info("No styled subtitles found");
      return parts;
    }

    List<Path> scripts =
        tracksByPart.values().stream()
            .flatMap(List::stream)
            .map(SubtitleTrack::path)
            .toList();
    LOGGER.info("Making substyles unique across {} scripts", scripts.size());
    styleUnifier.unify(scripts, properties.subtitles().playResolution());

    LOGGER.info("Remuxing subtitles");
    Map<Path, Path> remuxed = new LinkedHashMap<>();
    int index = 1;
    for (Map.Entry<Path, List<SubtitleTrack>> entry : tracksByPart.entrySet()) {
      String name = String.format("fixsubs-%03d-%s", index++, entry.getKey().getFileName());
      Path output = workspace.parts().resolve(name);
      remuxed.put(
          entry.getKey(),
          toolchain.remuxSubtitles(entry.getKey(), entry.getValue(), attachments, output));
    }
    return parts.stream().map(part -> remuxed.getOrDefault(part, part)).toList();
  }

  static void deleteWorkspace(Workspace workspace) {
    try {
      workspace.delete();
    } catch (IOException e) {
      LOGGER.warn("Unable to delete intermediate files in {}", workspace.root(), e);
    }
  }

  private static List<Path> listFiles(Path directory) throws IOException {
    try (Stream<Path> listing = Files.list(directory)) {
      return listing.filter(Files::isRegularFile).sorted().toList();
    }
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
