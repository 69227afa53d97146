package com.scholary.unlinkmkv.chapter;

import static com.scholary.unlinkmkv.chapter.ChapterXmlFixtures.chapters;
import static com.scholary.unlinkmkv.chapter.ChapterXmlFixtures.disabled;
import static com.scholary.unlinkmkv.chapter.ChapterXmlFixtures.edition;
import static com.scholary.unlinkmkv.chapter.ChapterXmlFixtures.external;
import static com.scholary.unlinkmkv.chapter.ChapterXmlFixtures.internal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.unlinkmkv.timecode.Timecode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChapterDocumentTest {

  private static final String OP_UID = "0x0A 0x0B 0x0C 0x0D";

  private static final String LINKED =
      chapters(
          edition(
              true,
              true,
              external("Opening", "00:00:00.000000000", "00:01:30.000000000", OP_UID),
              internal("Part A", "00:00:00.000000000", "00:10:00.000000000"),
              disabled("Preview", "00:00:00.000000000", "00:00:15.000000000", "0xff")),
          edition(
              false, false, internal("Everything", "00:00:00.000000000", "00:20:00.000000000")));

  @Test
  void isLinked_shouldDetectSegmentReferences() {
    assertThat(ChapterDocument.isLinked(LINKED)).isTrue();
    assertThat(
            ChapterDocument.isLinked(
                chapters(edition(true, false, internal("A", "00:00:00", "00:01:00")))))
        .isFalse();
    assertThat(ChapterDocument.isLinked("")).isFalse();
    assertThat(ChapterDocument.isLinked(null)).isFalse();
  }

  @Test
  void entries_shouldExposeTimesAndReferences() {
    ChapterDocument document = ChapterDocument.parse(LINKED);

    List<ChapterEntry> entries = document.entries(1);

    assertThat(document.editionCount()).isEqualTo(2);
    assertThat(entries).hasSize(3);

    ChapterEntry opening = entries.get(0);
    assertThat(opening.isExternal()).isTrue();
    assertThat(opening.getSegmentUid()).isPresent();
    assertThat(opening.getSegmentUid().get().normalized()).isEqualTo("0a0b0c0d");
    assertThat(opening.getOriginalEnd()).isEqualTo(Timecode.ofSeconds(90));
    assertThat(opening.getTitle()).contains("Opening");

    assertThat(entries.get(1).isExternal()).isFalse();
    assertThat(entries.get(1).getSegmentUid()).isEmpty();

    // disabled chapters stay internal even with a reference
    assertThat(entries.get(2).isEnabled()).isFalse();
    assertThat(entries.get(2).isExternal()).isFalse();
  }

  @Test
  void entries_shouldSkipAtomsWithoutTimes() {
    String xml =
        chapters(
            edition(
                true,
                true,
                "    <ChapterAtom><ChapterUID>5</ChapterUID></ChapterAtom>\n",
                internal("A", "00:00:00", "00:01:00")));

    assertThat(ChapterDocument.parse(xml).entries(1)).hasSize(1);
  }

  @Test
  void entries_shouldRejectUnknownEdition() {
    ChapterDocument document = ChapterDocument.parse(LINKED);

    assertThatThrownBy(() -> document.entries(3))
        .isInstanceOf(NoSuchEditionException.class)
        .hasMessageContaining("3");
    assertThatThrownBy(() -> document.entries(0)).isInstanceOf(NoSuchEditionException.class);
  }

  @Test
  void parse_shouldRejectInvalidXml() {
    assertThatThrownBy(() -> ChapterDocument.parse("<Chapters><EditionEntry>"))
        .isInstanceOf(MalformedChapterStructureException.class);
    assertThatThrownBy(() -> ChapterDocument.parse("  "))
        .isInstanceOf(MalformedChapterStructureException.class);
  }

  @Test
  void parse_shouldIgnoreExternalDoctype() {
    String xml =
        "<?xml version=\"1.0\"?>\n"
            + "<!DOCTYPE Chapters SYSTEM \"matroskachapters.dtd\">\n"
            + "<Chapters>"
            + edition(true, false, internal("A", "00:00:00", "00:01:00"))
            + "</Chapters>";

    assertThat(ChapterDocument.parse(xml).entries(1)).hasSize(1);
  }

  @Test
  void parse_shouldRejectInvalidChapterTimes() {
    String xml = chapters(edition(true, true, internal("A", "not-a-time", "00:01:00")));
    ChapterDocument document = ChapterDocument.parse(xml);

    assertThatThrownBy(() -> document.entries(1))
        .isInstanceOf(MalformedChapterStructureException.class);
  }

  @Test
  void dropNonDefaultEditions_shouldRemoveOnlyNonDefault() {
    ChapterDocument document = ChapterDocument.parse(LINKED);

    int dropped = document.dropNonDefaultEditions();

    assertThat(dropped).isEqualTo(1);
    assertThat(document.editionCount()).isEqualTo(1);
    assertThat(document.entries(1)).hasSize(3);
  }

  @Test
  void selectEdition_shouldKeepOnlyChosenEdition() {
    ChapterDocument document = ChapterDocument.parse(LINKED);

    document.selectEdition(2);

    assertThat(document.editionCount()).isEqualTo(1);
    assertThat(document.entries(1).get(0).getTitle()).contains("Everything");
  }

  @Test
  void serialize_shouldWriteRewrittenTimesWithoutReferences() {
    ChapterDocument document = ChapterDocument.parse(LINKED);
    ChapterEntry opening = document.entries(1).get(0);
    opening.setStartTime(Timecode.ofSeconds(5));
    opening.setEndTime(Timecode.ofSeconds(95));

    document.clearOrderedFlag();
    document.stripSegmentReferences();
    String xml = new String(document.serialize(), StandardCharsets.UTF_8);

    assertThat(xml).startsWith("<?xml");
    assertThat(xml).contains("UTF-8");
    assertThat(xml).contains("<ChapterTimeStart>00:00:05.000000000</ChapterTimeStart>");
    assertThat(xml).contains("<ChapterTimeEnd>00:01:35.000000000</ChapterTimeEnd>");
    assertThat(xml).doesNotContain("ChapterSegmentUID");
    assertThat(xml).doesNotContain("EditionFlagOrdered");
    assertThat(xml).contains("<ChapterString>Opening</ChapterString>");
  }

  @Test
  void serialize_shouldProduceParseableXml() {
    ChapterDocument document = ChapterDocument.parse(LINKED);

    String xml = new String(document.serialize(), StandardCharsets.UTF_8);
    ChapterDocument reparsed = ChapterDocument.parse(xml);

    assertThat(reparsed.editionCount()).isEqualTo(2);
    assertThat(reparsed.entries(1)).hasSize(3);
  }
}
