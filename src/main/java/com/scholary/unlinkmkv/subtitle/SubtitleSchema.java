package com.scholary.unlinkmkv.subtitle;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Field positions declared by a script's {@code Format:} lines.
 *
 * <p>ASS/SSA scripts declare the order of comma-separated fields per section, for example {@code
 * Format: Name, Fontname, Fontsize, ...} under {@code [V4+ Styles]} and {@code Format: Layer,
 * Start, End, Style, ...} under {@code [Events]}. The schema is resolved in a separate pass before
 * any line is rewritten, so the order of the sections in the file does not matter.
 *
 * @param styleNameIndex zero-based index of {@code Name} in style lines
 * @param dialogueStyleIndex zero-based index of {@code Style} in event lines
 */
public record SubtitleSchema(OptionalInt styleNameIndex, OptionalInt dialogueStyleIndex) {

  private static final String FORMAT_PREFIX = "format:";

  /** Resolve the schema of a script from its lines. Only the first Format line per section counts. */
  public static SubtitleSchema resolve(List<String> lines) {
    OptionalInt styleNameIndex = OptionalInt.empty();
    OptionalInt dialogueStyleIndex = OptionalInt.empty();
    ScriptSection section = ScriptSection.NONE;

    for (String line : lines) {
      ScriptSection header = ScriptSection.ofHeader(line);
      if (header != null) {
        section = header;
        continue;
      }
      if (!isFormatLine(line)) {
        continue;
      }
      if (section == ScriptSection.STYLES && styleNameIndex.isEmpty()) {
        styleNameIndex = fieldIndex(line, "name");
      } else if (section == ScriptSection.EVENTS && dialogueStyleIndex.isEmpty()) {
        dialogueStyleIndex = fieldIndex(line, "style");
      }
    }
    return new SubtitleSchema(styleNameIndex, dialogueStyleIndex);
  }

  /** Both indices are known, so styles can be renamed without breaking event references. */
  public boolean isComplete() {
    return styleNameIndex.isPresent() && dialogueStyleIndex.isPresent();
  }

  static boolean isFormatLine(String line) {
    return line.toLowerCase(Locale.ROOT).startsWith(FORMAT_PREFIX);
  }

  private static OptionalInt fieldIndex(String formatLine, String field) {
    String[] fields = formatLine.substring(FORMAT_PREFIX.length()).split(",");
    for (int i = 0; i < fields.length; i++) {
      if (fields[i].trim().toLowerCase(Locale.ROOT).equals(field)) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }
}
