package com.scholary.unlinkmkv.chapter;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A segment UID as written in a chapter file, tagged with its encoding.
 *
 * <p>{@link #normalized()} gives the lowercase hex form that segment registries are keyed by.
 */
public record SegmentUid(String text, UidFormat format) {

  public SegmentUid {
    if (text == null) {
      throw new IllegalArgumentException("Segment UID text must not be null");
    }
    if (format == null) {
      throw new IllegalArgumentException("Segment UID format must not be null");
    }
  }

  public String normalized() {
    return switch (format) {
      case HEX -> normalizeHex(text);
      case ASCII -> asciiToHex(text.trim());
    };
  }

  /** Strip whitespace and {@code 0x} byte prefixes from a hex UID and lowercase it. */
  public static String normalizeHex(String hex) {
    // "x" is not a hex digit, so every "0x" is a prefix
    return hex.replaceAll("\\s+", "").toLowerCase(Locale.ROOT).replace("0x", "");
  }

  private static String asciiToHex(String ascii) {
    StringBuilder hex = new StringBuilder();
    for (byte b : ascii.getBytes(StandardCharsets.UTF_8)) {
      hex.append(String.format("%02x", b & 0xff));
    }
    return hex.toString();
  }
}
