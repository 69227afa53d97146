package com.scholary.unlinkmkv.subtitle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SubtitleScriptTest {

  private static final byte[] BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  @TempDir Path tempDir;

  @Test
  void parse_shouldSplitLinesAndRememberLayout() throws IOException {
    SubtitleScript script =
        SubtitleScript.parse("[Script Info]\r\nTitle: x\r\n".getBytes(StandardCharsets.UTF_8));

    assertThat(script.getLines()).containsExactly("[Script Info]", "Title: x");
    assertThat(script.hasByteOrderMark()).isFalse();
    assertThat(new String(script.toBytes(), StandardCharsets.UTF_8))
        .isEqualTo("[Script Info]\r\nTitle: x\r\n");
  }

  @Test
  void toBytes_shouldKeepByteOrderMark() throws IOException {
    ByteArrayOutputStream content = new ByteArrayOutputStream();
    content.write(BOM);
    content.write("[Events]\nDialogue: 0,ä\n".getBytes(StandardCharsets.UTF_8));
    Path file = tempDir.resolve("bom.ass");
    Files.write(file, content.toByteArray());

    SubtitleScript script = SubtitleScript.read(file);
    script.withLines(List.of("[Events]", "Dialogue: 1,ä")).write(file);
    byte[] written = Files.readAllBytes(file);

    assertThat(script.hasByteOrderMark()).isTrue();
    assertThat(script.getLines().get(0)).isEqualTo("[Events]");
    assertThat(written[0]).isEqualTo(BOM[0]);
    assertThat(written[1]).isEqualTo(BOM[1]);
    assertThat(written[2]).isEqualTo(BOM[2]);
    assertThat(new String(written, 3, written.length - 3, StandardCharsets.UTF_8))
        .isEqualTo("[Events]\nDialogue: 1,ä\n");
  }

  @Test
  void toBytes_shouldNotAddByteOrderMark() throws IOException {
    byte[] content = "[Events]".getBytes(StandardCharsets.UTF_8);

    SubtitleScript script = SubtitleScript.parse(content);

    assertThat(script.hasByteOrderMark()).isFalse();
    assertThat(script.toBytes()).isEqualTo(content);
  }

  @Test
  void parse_shouldHandleEmptyContent() throws IOException {
    SubtitleScript script = SubtitleScript.parse(new byte[0]);

    assertThat(script.getLines()).isEmpty();
    assertThat(script.toBytes()).isEmpty();
  }

  @Test
  void parse_shouldRejectContentThatIsNotUtf8() {
    byte[] latin1 = "[Events]\nDialogue: 0,caf\u00e9\n".getBytes(StandardCharsets.ISO_8859_1);

    assertThatThrownBy(() -> SubtitleScript.parse(latin1))
        .isInstanceOf(CharacterCodingException.class);
  }
}
