package com.scholary.unlinkmkv.api;

import com.scholary.unlinkmkv.service.TimelinePreview;
import com.scholary.unlinkmkv.timecode.Timecode;
import com.scholary.unlinkmkv.timeline.Part;
import com.scholary.unlinkmkv.timeline.TimelineSegment;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Planned reconstruction of a file.
 *
 * <p>Shows where the file would be split, which files would be appended and the chapter XML that
 * would be written, without touching any media.
 */
public record ChapterPreviewResponse(
    String file,
    List<SegmentResponse> segments,
    List<String> splitPoints,
    List<PartResponse> parts,
    String chapters) {

  /** Source of one chapter, with its original times. */
  public record SegmentResponse(
      int chapter, TimelineSegment.Kind kind, String start, String end, String file) {}

  public record PartResponse(Part.Kind kind, String file, int slice) {}

  public static ChapterPreviewResponse from(TimelinePreview preview) {
    return new ChapterPreviewResponse(
        preview.plan().source().toString(),
        preview.plan().segments().stream()
            .map(
                segment ->
                    new SegmentResponse(
                        segment.chapterIndex(),
                        segment.kind(),
                        segment.start().toString(),
                        segment.end().toString(),
                        segment.file().toString()))
            .toList(),
        preview.plan().splitPoints().stream().map(Timecode::toString).toList(),
        preview.parts().stream()
            .map(part -> new PartResponse(part.kind(), part.file().toString(), part.sliceIndex()))
            .toList(),
        new String(preview.plan().chapters().serialize(), StandardCharsets.UTF_8));
  }
}
