package com.scholary.unlinkmkv.subtitle;

import com.scholary.unlinkmkv.logging.StructuredLogger;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Makes subtitle styles from several parts coexist in one merged track.
 *
 * <p>When parts are appended, mkvmerge keeps only the style catalog of the first part's track, so
 * a {@code Default} style in part two silently takes the look of part one's {@code Default}. Style
 * unification runs in two passes over all subtitle files that end up in the same output:
 *
 * <ol>
 *   <li><b>Disambiguate</b>: in every file, suffix each style name with a tag derived from the
 *       file's path and rewrite the style references of its events the same way. All rewritten
 *       style lines are collected in order.
 *   <li><b>Merge</b>: replace the style lines of every file with the full collected list, so each
 *       part carries the same catalog.
 * </ol>
 *
 * <p>Files whose styles or events section has no {@code Format:} line, and files that are not valid
 * UTF-8, are left untouched by both passes. A file is passed through as a whole even when only one
 * section lacks its {@code Format:} line, so its event references never point at renamed styles.
 */
@Component
public class StyleUnifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(StyleUnifier.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final String STYLE_PREFIX = "style:";
  private static final String PLAY_RES_X = "PlayResX:";
  private static final String PLAY_RES_Y = "PlayResY:";

  /**
   * Run both passes over a set of subtitle files, rewriting them in place.
   *
   * @return the merged style catalog
   */
  public List<StyleEntry> unify(List<Path> files, PlayResolution playResolution)
      throws IOException {
    List<StyleEntry> styles = disambiguate(files);
    merge(files, styles, playResolution);
    return styles;
  }

  /**
   * Pass 1: rename styles per file and collect the renamed definitions.
   *
   * @param files subtitle files, rewritten in place
   * @return every renamed style line, in file and line order
   */
  public List<StyleEntry> disambiguate(List<Path> files) throws IOException {
    List<StyleEntry> styles = new ArrayList<>();
    for (Path file : files) {
      LOGGER.debug("Disambiguating styles in {}", file);
      SubtitleScript script;
      try {
        script = SubtitleScript.read(file);
      } catch (CharacterCodingException e) {
        structuredLogger.logSubtitlePassthrough(file.toString(), "not valid UTF-8");
        continue;
      }
      List<StyleEntry> fileStyles = new ArrayList<>();
      SubtitleScript rewritten = disambiguate(script, sourceTag(file), fileStyles, file.toString());
      if (rewritten != script) {
        rewritten.write(file);
      }
      styles.addAll(fileStyles);
    }
    LOGGER.info("Collected {} styles from {} subtitle files", styles.size(), files.size());
    return styles;
  }

  /**
   * Pass 1 for a single script.
   *
   * @param script the script
   * @param sourceTag suffix tag unique to the script's file
   * @param collected receives the renamed styles
   * @param label name used in log messages
   * @return the rewritten script, or {@code script} itself if its schema is incomplete
   */
  SubtitleScript disambiguate(
      SubtitleScript script, String sourceTag, List<StyleEntry> collected, String label) {
    SubtitleSchema schema = SubtitleSchema.resolve(script.getLines());
    if (!schema.isComplete()) {
      logPassthrough(schema, label);
      return script;
    }
    int nameIndex = schema.styleNameIndex().getAsInt();
    int styleIndex = schema.dialogueStyleIndex().getAsInt();
    String suffix = " u" + sourceTag;

    List<String> lines = new ArrayList<>();
    ScriptSection section = ScriptSection.NONE;
    for (String line : script.getLines()) {
      ScriptSection header = ScriptSection.ofHeader(line);
      if (header != null) {
        section = header;
        lines.add(line);
        continue;
      }

      if (section == ScriptSection.STYLES && startsWithIgnoreCase(line, STYLE_PREFIX)) {
        String[] fields = fieldsOf(line, -1);
        if (nameIndex < fields.length) {
          fields[nameIndex] = fields[nameIndex] + suffix;
          String rewritten = "Style: " + String.join(",", fields);
          collected.add(new StyleEntry(fields[nameIndex], rewritten, sourceTag));
          LOGGER.debug(rewritten);
          line = rewritten;
        }
      } else if (section == ScriptSection.EVENTS && isEventLine(line)) {
        String type = line.substring(0, line.indexOf(':')).trim();
        // limit keeps commas inside the event text intact
        String[] fields = fieldsOf(line, styleIndex + 2);
        if (styleIndex < fields.length) {
          fields[styleIndex] = fields[styleIndex] + suffix;
          line = type + ": " + String.join(",", fields);
        }
      }
      lines.add(line);
    }
    return script.withLines(lines);
  }

  /**
   * Pass 2: give every file the complete style catalog.
   *
   * @param files subtitle files already processed by {@link #disambiguate(List)}
   * @param styles the collected catalog
   * @param playResolution optional script resolution override
   */
  public void merge(List<Path> files, List<StyleEntry> styles, PlayResolution playResolution)
      throws IOException {
    for (Path file : files) {
      SubtitleScript script;
      try {
        script = SubtitleScript.read(file);
      } catch (CharacterCodingException e) {
        LOGGER.debug("Not merging styles into {}, not valid UTF-8", file);
        continue;
      }
      SubtitleScript merged = merge(script, styles, playResolution, file.toString());
      if (merged != script) {
        merged.write(file);
      }
    }
    LOGGER.info("Applied {} styles to {} subtitle files", styles.size(), files.size());
  }

  /** Pass 2 for a single script. Returns {@code script} itself if its schema is incomplete. */
  SubtitleScript merge(
      SubtitleScript script, List<StyleEntry> styles, PlayResolution playResolution, String label) {
    if (!SubtitleSchema.resolve(script.getLines()).isComplete()) {
      LOGGER.debug("Not merging styles into {}", label);
      return script;
    }

    List<String> lines = new ArrayList<>();
    ScriptSection section = ScriptSection.NONE;
    boolean catalogWritten = false;
    for (String line : script.getLines()) {
      ScriptSection header = ScriptSection.ofHeader(line);
      if (header != null) {
        section = header;
        lines.add(line);
        continue;
      }

      if (section == ScriptSection.STYLES) {
        if (startsWithIgnoreCase(line, STYLE_PREFIX)) {
          continue;
        }
        lines.add(line);
        if (!catalogWritten && SubtitleSchema.isFormatLine(line)) {
          styles.forEach(style -> lines.add(style.definitionLine()));
          catalogWritten = true;
        }
        continue;
      }

      if (playResolution.x() != null && line.startsWith(PLAY_RES_X)) {
        lines.add(PLAY_RES_X + " " + playResolution.x());
      } else if (playResolution.y() != null && line.startsWith(PLAY_RES_Y)) {
        lines.add(PLAY_RES_Y + " " + playResolution.y());
      } else {
        lines.add(line);
      }
    }
    return script.withLines(lines);
  }

  /** Deterministic tag for a file: CRC-32 of its path, so the same path always gets the same tag. */
  public static String sourceTag(Path file) {
    CRC32 crc = new CRC32();
    crc.update(file.toString().getBytes(StandardCharsets.UTF_8));
    return Long.toString(crc.getValue());
  }

  private void logPassthrough(SubtitleSchema schema, String label) {
    if (schema.styleNameIndex().isEmpty()) {
      structuredLogger.logSubtitlePassthrough(label, "no Format line in styles section");
    }
    if (schema.dialogueStyleIndex().isEmpty()) {
      structuredLogger.logSubtitlePassthrough(label, "no Format line in events section");
    }
  }

  private static String[] fieldsOf(String line, int limit) {
    String body = line.substring(line.indexOf(':') + 1).stripLeading();
    return body.split(",", limit);
  }

  private static boolean isEventLine(String line) {
    return startsWithIgnoreCase(line, "dialogue:") || startsWithIgnoreCase(line, "comment:");
  }

  private static boolean startsWithIgnoreCase(String line, String prefix) {
    return line.toLowerCase(Locale.ROOT).startsWith(prefix);
  }
}
