package com.scholary.unlinkmkv.toolchain;

import java.util.List;

/**
 * One mkvpropedit property assignment.
 *
 * <p>The selector is either {@code info} for segment-level properties or {@code track:<type><n>}
 * (for example {@code track:a1}) for the n-th track of a type.
 *
 * @param selector mkvpropedit edit selector
 * @param property property name
 * @param value new value
 */
public record MetadataEdit(String selector, String property, String value) {

  public static MetadataEdit title(String title) {
    return new MetadataEdit("info", "title", title);
  }

  public static MetadataEdit track(char type, int number, String property, String value) {
    return new MetadataEdit("track:" + type + number, property, value);
  }

  /** Command line arguments for this edit. */
  public List<String> toArguments() {
    return List.of("--edit", selector, "--set", property + "=" + value);
  }
}
