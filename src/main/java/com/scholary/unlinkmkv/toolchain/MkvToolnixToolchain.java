package com.scholary.unlinkmkv.toolchain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.unlinkmkv.segment.SegmentProbe;
import com.scholary.unlinkmkv.timecode.Timecode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link Toolchain} backed by the MKVToolNix command line tools.
 *
 * <p>File information comes from {@code mkvmerge -J}, whose JSON output is stable across versions
 * and locales:
 *
 * <pre>
 * {
 *   "container": {"properties": {"segment_uid": "...", "duration": 1420000000, "title": "..."}},
 *   "tracks": [{"id": 2, "type": "subtitles",
 *               "properties": {"codec_id": "S_TEXT/ASS", "language": "eng", ...}}],
 *   "attachments": [{"id": 1, "file_name": "font.ttf", "content_type": "font/ttf"}]
 * }
 * </pre>
 *
 * <p>Splitting, remuxing and appending use {@code mkvmerge}, extraction uses {@code mkvextract} and
 * metadata edits use {@code mkvpropedit}.
 */
@Component
public class MkvToolnixToolchain implements Toolchain {

  private static final Logger LOGGER = LoggerFactory.getLogger(MkvToolnixToolchain.class);

  private static final String SPLIT_PATTERN = "split-%03d.mkv";
  private static final Map<String, String> SCRIPT_EXTENSIONS =
      Map.of("S_TEXT/ASS", ".ass", "S_TEXT/SSA", ".ssa");
  private static final Map<String, Character> TRACK_TYPES =
      Map.of("audio", 'a', "subtitles", 's');

  private final MkvToolnixProperties properties;
  private final ProcessRunner processRunner;
  private final ObjectMapper objectMapper;

  public MkvToolnixToolchain(
      MkvToolnixProperties properties, ProcessRunner processRunner, ObjectMapper objectMapper) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.objectMapper = objectMapper;
  }

  @Override
  public String readChapters(Path file) throws IOException {
    Path target = Files.createTempFile("chapters-", ".xml");
    try {
      processRunner.run(
          command(
              properties.mkvextract(), file.toString(), "chapters", target.toString()));
      if (!Files.exists(target) || Files.size(target) == 0) {
        LOGGER.debug("{} has no chapters", file.getFileName());
        return "";
      }
      return Files.readString(target, StandardCharsets.UTF_8);
    } finally {
      Files.deleteIfExists(target);
    }
  }

  @Override
  public SegmentProbe probeSegment(Path file) {
    JsonNode container = identify(file).path("container").path("properties");
    String segmentId = container.path("segment_uid").asText(null);
    Timecode duration = Timecode.ofNanos(container.path("duration").asLong(0));
    return new SegmentProbe(segmentId, duration);
  }

  @Override
  public List<Path> splitFile(Path file, List<Timecode> splitPoints, Path outputDir)
      throws IOException {
    if (splitPoints.isEmpty()) {
      return List.of(file);
    }
    String timestamps =
        splitPoints.stream().map(Timecode::toString).collect(Collectors.joining(","));
    LOGGER.info("Creating {} splits from {}", splitPoints.size() + 1, file.getFileName());

    Files.createDirectories(outputDir);
    processRunner.run(
        command(
            properties.mkvmerge(),
            "--no-chapters",
            "-o",
            outputDir.resolve(SPLIT_PATTERN).toString(),
            file.toString(),
            "--split",
            "timestamps:" + timestamps));

    try (Stream<Path> listing = Files.list(outputDir)) {
      return listing
          .filter(p -> p.getFileName().toString().matches("split-\\d{3}\\.mkv"))
          .sorted()
          .toList();
    }
  }

  @Override
  public List<SubtitleTrack> extractSubtitleTracks(Path file, Path outputDir) throws IOException {
    List<SubtitleTrack> tracks = new ArrayList<>();
    for (JsonNode track : identify(file).path("tracks")) {
      if (!"subtitles".equals(track.path("type").asText())) {
        continue;
      }
      JsonNode props = track.path("properties");
      String extension = SCRIPT_EXTENSIONS.get(props.path("codec_id").asText());
      if (extension == null) {
        LOGGER.debug(
            "Keeping {} track {} of {} as is",
            props.path("codec_id").asText("unknown"),
            track.path("id").asInt(),
            file.getFileName());
        continue;
      }
      int trackId = track.path("id").asInt();
      Path target = outputDir.resolve(file.getFileName() + "-" + trackId + extension);
      tracks.add(
          new SubtitleTrack(
              trackId,
              target,
              props.path("language").asText(null),
              props.path("track_name").asText(null)));
    }
    if (tracks.isEmpty()) {
      return List.of();
    }

    Files.createDirectories(outputDir);
    List<String> args = new ArrayList<>(List.of(file.toString(), "tracks"));
    tracks.forEach(track -> args.add(track.trackId() + ":" + track.path()));
    processRunner.run(command(properties.mkvextract(), args));

    LOGGER.info("Extracted {} subtitle tracks from {}", tracks.size(), file.getFileName());
    return List.copyOf(tracks);
  }

  @Override
  public List<Path> extractAttachments(Path file, Path outputDir) throws IOException {
    List<String> specs = new ArrayList<>();
    List<Path> extracted = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (JsonNode attachment : identify(file).path("attachments")) {
      String name = attachment.path("file_name").asText();
      Path target = outputDir.resolve(name);
      if (name.isEmpty() || !seen.add(name) || Files.exists(target)) {
        LOGGER.info("Skipping (duplicate) attachment {}", name);
        continue;
      }
      specs.add(attachment.path("id").asInt() + ":" + target);
      extracted.add(target);
    }
    if (specs.isEmpty()) {
      return List.of();
    }

    Files.createDirectories(outputDir);
    List<String> args = new ArrayList<>(List.of(file.toString(), "attachments"));
    args.addAll(specs);
    processRunner.run(command(properties.mkvextract(), args));

    LOGGER.info("Extracted {} attachments from {}", extracted.size(), file.getFileName());
    return List.copyOf(extracted);
  }

  @Override
  public Path remuxSubtitles(
      Path part, List<SubtitleTrack> tracks, List<Path> attachments, Path output)
      throws IOException {
    List<String> args = new ArrayList<>(List.of("-o", output.toString(), "--no-chapters", "-M"));
    if (!tracks.isEmpty()) {
      args.add("--subtitle-tracks");
      args.add(
          "!"
              + tracks.stream()
                  .map(track -> String.valueOf(track.trackId()))
                  .collect(Collectors.joining(",")));
    }
    args.add(part.toString());

    for (SubtitleTrack track : tracks) {
      if (track.language() != null) {
        args.add("--language");
        args.add("0:" + track.language());
      }
      if (track.name() != null) {
        args.add("--track-name");
        args.add("0:" + track.name());
      }
      args.add(track.path().toString());
    }
    args.addAll(attachArguments(attachments));

    Files.createDirectories(output.getParent());
    processRunner.run(command(properties.mkvmerge(), args));
    return output;
  }

  @Override
  public Path muxParts(List<Path> parts, Path chapterFile, List<Path> attachments, Path output)
      throws IOException {
    List<String> args = new ArrayList<>(List.of("-o", output.toString()));
    if (chapterFile != null) {
      args.add("--chapters");
      args.add(chapterFile.toString());
    }
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) {
        args.add("+");
      }
      args.add("--no-chapters");
      args.add("-M");
      args.add(parts.get(i).toString());
    }
    args.addAll(attachArguments(attachments));

    LOGGER.info("Appending {} parts into {}", parts.size(), output.getFileName());
    Files.createDirectories(output.getParent());
    processRunner.run(command(properties.mkvmerge(), args));
    return output;
  }

  @Override
  public List<MetadataEdit> probeMetadata(Path file) {
    JsonNode root = identify(file);
    List<MetadataEdit> edits = new ArrayList<>();

    String title = root.path("container").path("properties").path("title").asText(null);
    if (title != null) {
      edits.add(MetadataEdit.title(title));
    }

    Map<Character, Integer> counters = new HashMap<>();
    for (JsonNode track : root.path("tracks")) {
      Character type = TRACK_TYPES.get(track.path("type").asText());
      if (type == null) {
        continue;
      }
      int number = counters.merge(type, 1, Integer::sum);
      JsonNode props = track.path("properties");
      if (props.hasNonNull("language")) {
        edits.add(MetadataEdit.track(type, number, "language", props.get("language").asText()));
      }
      if (props.hasNonNull("track_name")) {
        edits.add(MetadataEdit.track(type, number, "name", props.get("track_name").asText()));
      }
      if (props.hasNonNull("default_track")) {
        edits.add(
            MetadataEdit.track(
                type, number, "flag-default", props.get("default_track").asBoolean() ? "1" : "0"));
      }
    }
    LOGGER.debug("Read {} metadata properties from {}", edits.size(), file.getFileName());
    return List.copyOf(edits);
  }

  @Override
  public void applyMetadata(Path file, List<MetadataEdit> edits) {
    if (edits.isEmpty()) {
      return;
    }
    List<String> args = new ArrayList<>(List.of(file.toString()));
    edits.forEach(edit -> args.addAll(edit.toArguments()));
    processRunner.run(command(properties.mkvpropedit(), args));
    LOGGER.info("Applied {} metadata properties to {}", edits.size(), file.getFileName());
  }

  private JsonNode identify(Path file) {
    List<String> command = command(properties.mkvmerge(), "-J", file.toString());
    String output = processRunner.run(command);
    try {
      return objectMapper.readTree(output);
    } catch (JsonProcessingException e) {
      throw new ExternalToolException(command, "Unreadable identification output", e);
    }
  }

  private List<String> attachArguments(List<Path> attachments) {
    List<String> args = new ArrayList<>();
    for (Path attachment : attachments) {
      String mimeType = fontMimeType(attachment);
      if (mimeType != null) {
        args.add("--attachment-mime-type");
        args.add(mimeType);
      }
      args.add("--attach-file");
      args.add(attachment.toString());
    }
    return args;
  }

  /** Font MIME type by extension; {@code null} lets mkvmerge detect it. */
  static String fontMimeType(Path attachment) {
    String name = attachment.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".ttf") || name.endsWith(".ttc")) {
      return "application/x-truetype-font";
    }
    if (name.endsWith(".otf")) {
      return "application/vnd.ms-opentype";
    }
    return null;
  }

  private List<String> command(String binary, String... args) {
    return command(binary, List.of(args));
  }

  private List<String> command(String binary, List<String> args) {
    List<String> command = new ArrayList<>();
    command.add(binary);
    command.add("--ui-language");
    command.add(properties.locale());
    command.addAll(args);
    return command;
  }
}
