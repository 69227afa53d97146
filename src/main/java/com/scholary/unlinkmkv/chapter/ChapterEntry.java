package com.scholary.unlinkmkv.chapter;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * One {@code ChapterAtom} of an edition.
 *
 * <p>Values are read once from the backing element. Setters write through to the element, so the
 * owning {@link ChapterDocument} serializes the rewritten times.
 */
public class ChapterEntry {

  static final String TIME_START = "ChapterTimeStart";
  static final String TIME_END = "ChapterTimeEnd";
  static final String FLAG_ENABLED = "ChapterFlagEnabled";
  static final String SEGMENT_UID = "ChapterSegmentUID";

  private final Element element;
  private final Timecode originalStart;
  private final Timecode originalEnd;
  private final boolean enabled;
  private final SegmentUid segmentUid;

  private Timecode startTime;
  private Timecode endTime;

  ChapterEntry(Element element) {
    this.element = element;
    this.originalStart = parseTime(element, TIME_START);
    this.originalEnd = parseTime(element, TIME_END);
    this.startTime = originalStart;
    this.endTime = originalEnd;

    Element enabledElement = ChapterDocument.firstChild(element, FLAG_ENABLED);
    this.enabled = enabledElement == null || !"0".equals(enabledElement.getTextContent().trim());

    Element uidElement = ChapterDocument.firstChild(element, SEGMENT_UID);
    this.segmentUid =
        uidElement == null || uidElement.getTextContent().isBlank()
            ? null
            : new SegmentUid(
                uidElement.getTextContent(),
                UidFormat.fromAttribute(uidElement.getAttribute("format")));
  }

  private static Timecode parseTime(Element atom, String name) {
    Element child = ChapterDocument.firstChild(atom, name);
    try {
      return Timecode.parse(child.getTextContent());
    } catch (IllegalArgumentException e) {
      throw new MalformedChapterStructureException("Invalid " + name + " in chapter atom", e);
    }
  }

  /** Whether the atom carries both a start and an end time. */
  static boolean isComplete(Element atom) {
    return ChapterDocument.firstChild(atom, TIME_START) != null
        && ChapterDocument.firstChild(atom, TIME_END) != null;
  }

  public Timecode getOriginalStart() {
    return originalStart;
  }

  public Timecode getOriginalEnd() {
    return originalEnd;
  }

  public Timecode getStartTime() {
    return startTime;
  }

  public Timecode getEndTime() {
    return endTime;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Optional<SegmentUid> getSegmentUid() {
    return Optional.ofNullable(segmentUid);
  }

  /** Whether this chapter's content lives in another file. Disabled links are treated as local. */
  public boolean isExternal() {
    return enabled && segmentUid != null;
  }

  public void setStartTime(Timecode startTime) {
    this.startTime = startTime;
    ChapterDocument.firstChild(element, TIME_START).setTextContent(startTime.toString());
  }

  public void setEndTime(Timecode endTime) {
    this.endTime = endTime;
    ChapterDocument.firstChild(element, TIME_END).setTextContent(endTime.toString());
  }

  /** Remove the {@code ChapterSegmentUID} element, if present. */
  public void removeSegmentUid() {
    Element uidElement = ChapterDocument.firstChild(element, SEGMENT_UID);
    if (uidElement != null) {
      element.removeChild(uidElement);
    }
  }

  /** Chapter title from the first {@code ChapterDisplay}, mainly for logging. */
  public Optional<String> getTitle() {
    Element display = ChapterDocument.firstChild(element, "ChapterDisplay");
    if (display == null) {
      return Optional.empty();
    }
    Element title = ChapterDocument.firstChild(display, "ChapterString");
    return title == null ? Optional.empty() : Optional.of(title.getTextContent().trim());
  }
}
