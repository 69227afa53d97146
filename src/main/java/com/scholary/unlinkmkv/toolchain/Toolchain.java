package com.scholary.unlinkmkv.toolchain;

import com.scholary.unlinkmkv.segment.SegmentProber;
import com.scholary.unlinkmkv.timecode.Timecode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The Matroska operations the unlink pipeline depends on.
 *
 * <p>Every method runs external tools and fails with {@link ExternalToolException} when one of them
 * does.
 */
public interface Toolchain extends SegmentProber {

  /** Chapter XML of a file, or an empty string if it has no chapters. */
  String readChapters(Path file) throws IOException;

  /**
   * Split a file at the given timecodes.
   *
   * @return the slices in playback order, one more than there are split points
   */
  List<Path> splitFile(Path file, List<Timecode> splitPoints, Path outputDir) throws IOException;

  /** Extract every ASS/SSA subtitle track of a file into {@code outputDir}. */
  List<SubtitleTrack> extractSubtitleTracks(Path file, Path outputDir) throws IOException;

  /**
   * Extract a file's attachments into {@code outputDir}.
   *
   * <p>Attachments whose name already exists in {@code outputDir} are skipped.
   *
   * @return the newly extracted files
   */
  List<Path> extractAttachments(Path file, Path outputDir) throws IOException;

  /**
   * Replace extracted subtitle tracks of a part with their rewritten scripts.
   *
   * <p>Subtitle tracks that were not extracted are kept as they are.
   *
   * @param part media file
   * @param tracks tracks previously returned by {@link #extractSubtitleTracks} for {@code part}
   * @param attachments fonts to attach
   * @param output file to write
   * @return {@code output}
   */
  Path remuxSubtitles(Path part, List<SubtitleTrack> tracks, List<Path> attachments, Path output)
      throws IOException;

  /**
   * Append parts into one file.
   *
   * @param parts files in playback order
   * @param chapterFile chapter XML to attach, or {@code null} for no chapters
   * @param attachments fonts to attach
   * @param output file to write
   * @return {@code output}
   */
  Path muxParts(List<Path> parts, Path chapterFile, List<Path> attachments, Path output)
      throws IOException;

  /** Title and per-track language, name and default flag of a file. */
  List<MetadataEdit> probeMetadata(Path file) throws IOException;

  /** Apply metadata edits to a file in place. */
  void applyMetadata(Path file, List<MetadataEdit> edits) throws IOException;
}
