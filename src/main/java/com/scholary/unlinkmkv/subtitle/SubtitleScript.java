package com.scholary.unlinkmkv.subtitle;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text of an ASS/SSA script as a list of lines.
 *
 * <p>Scripts are UTF-8; content that is not valid UTF-8 is rejected rather than decoded lossily. A
 * leading byte-order mark, the line separator and the presence of a final
 * newline are remembered and written back unchanged, so an untouched script round-trips
 * byte-for-byte.
 */
public class SubtitleScript {

  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

  private final boolean byteOrderMark;
  private final String lineSeparator;
  private final boolean trailingNewline;
  private final List<String> lines;

  SubtitleScript(
      boolean byteOrderMark, String lineSeparator, boolean trailingNewline, List<String> lines) {
    this.byteOrderMark = byteOrderMark;
    this.lineSeparator = lineSeparator;
    this.trailingNewline = trailingNewline;
    this.lines = new ArrayList<>(lines);
  }

  public static SubtitleScript read(Path file) throws IOException {
    return parse(Files.readAllBytes(file));
  }

  /**
   * Decode a script.
   *
   * @throws CharacterCodingException if the content is not valid UTF-8
   */
  public static SubtitleScript parse(byte[] content) throws CharacterCodingException {
    boolean bom =
        content.length >= 3
            && content[0] == UTF8_BOM[0]
            && content[1] == UTF8_BOM[1]
            && content[2] == UTF8_BOM[2];
    int offset = bom ? UTF8_BOM.length : 0;
    String text =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(content, offset, content.length - offset))
            .toString();

    String separator = text.contains("\r\n") ? "\r\n" : "\n";
    boolean trailing = text.endsWith(separator);
    String body = trailing ? text.substring(0, text.length() - separator.length()) : text;
    List<String> lines = text.isEmpty() ? List.of() : Arrays.asList(body.split(separator, -1));
    return new SubtitleScript(bom, separator, trailing, lines);
  }

  public void write(Path file) throws IOException {
    Files.write(file, toBytes());
  }

  public byte[] toBytes() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    if (byteOrderMark) {
      out.writeBytes(UTF8_BOM);
    }
    String text = String.join(lineSeparator, lines);
    if (trailingNewline && !lines.isEmpty()) {
      text += lineSeparator;
    }
    out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    return out.toByteArray();
  }

  public List<String> getLines() {
    return List.copyOf(lines);
  }

  /** A copy of this script with different content but the same encoding details. */
  public SubtitleScript withLines(List<String> newLines) {
    return new SubtitleScript(byteOrderMark, lineSeparator, trailingNewline, newLines);
  }

  public boolean hasByteOrderMark() {
    return byteOrderMark;
  }
}
