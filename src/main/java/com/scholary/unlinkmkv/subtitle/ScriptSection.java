package com.scholary.unlinkmkv.subtitle;

import java.util.Locale;

/** The script sections style unification cares about. */
enum ScriptSection {
  NONE,
  STYLES,
  EVENTS,
  OTHER;

  /**
   * Classify a line. Returns null when the line is not a section header.
   *
   * <p>{@code [V4+ Styles]}, {@code [V4 Styles]} and similar headers are style sections.
   */
  static ScriptSection ofHeader(String line) {
    String trimmed = line.trim();
    if (!trimmed.startsWith("[") || !trimmed.endsWith("]")) {
      return null;
    }
    String name = trimmed.substring(1, trimmed.length() - 1).trim().toLowerCase(Locale.ROOT);
    if (name.endsWith("styles")) {
      return STYLES;
    }
    if (name.equals("events")) {
      return EVENTS;
    }
    return OTHER;
  }
}
