package com.scholary.unlinkmkv.subtitle;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SubtitleSchemaTest {

  @Test
  void resolve_shouldFindNameAndStyleColumns() {
    List<String> lines =
        List.of(
            "[Script Info]",
            "Title: test",
            "[V4+ Styles]",
            "Format: Name, Fontname, Fontsize",
            "[Events]",
            "Format: Layer, Start, End, Style, Name, Text");

    SubtitleSchema schema = SubtitleSchema.resolve(lines);

    assertThat(schema.styleNameIndex().getAsInt()).isZero();
    assertThat(schema.dialogueStyleIndex().getAsInt()).isEqualTo(3);
    assertThat(schema.isComplete()).isTrue();
  }

  @Test
  void resolve_shouldIgnoreCaseAndSectionOrder() {
    List<String> lines =
        List.of(
            "[events]",
            "FORMAT: Marked, Start, End, STYLE, Text",
            "[V4 Styles]",
            "format: Fontname, NAME, Fontsize");

    SubtitleSchema schema = SubtitleSchema.resolve(lines);

    assertThat(schema.styleNameIndex().getAsInt()).isEqualTo(1);
    assertThat(schema.dialogueStyleIndex().getAsInt()).isEqualTo(3);
  }

  @Test
  void resolve_shouldLeaveIndexUnsetWithoutFormatLine() {
    List<String> lines =
        List.of(
            "[V4+ Styles]",
            "Style: Default,Arial,20",
            "[Events]",
            "Format: Layer, Start, End, Style, Text");

    SubtitleSchema schema = SubtitleSchema.resolve(lines);

    assertThat(schema.styleNameIndex()).isEmpty();
    assertThat(schema.dialogueStyleIndex()).isPresent();
    assertThat(schema.isComplete()).isFalse();
  }

  @Test
  void resolve_shouldUseFirstFormatLinePerSection() {
    List<String> lines =
        List.of("[V4+ Styles]", "Format: Name, Fontname", "Format: Fontname, Name");

    assertThat(SubtitleSchema.resolve(lines).styleNameIndex().getAsInt()).isZero();
  }

  @Test
  void resolve_shouldIgnoreFormatLinesOutsideKnownSections() {
    List<String> lines = List.of("[Fonts]", "Format: Name, Style");

    SubtitleSchema schema = SubtitleSchema.resolve(lines);

    assertThat(schema.styleNameIndex()).isEmpty();
    assertThat(schema.dialogueStyleIndex()).isEmpty();
  }
}
