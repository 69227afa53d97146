package com.scholary.unlinkmkv.chapter;

/** Encoding of a {@code ChapterSegmentUID} value, taken from its {@code format} attribute. */
public enum UidFormat {
  HEX,
  ASCII;

  /**
   * Map the XML {@code format} attribute to a format. Missing or unknown values default to hex,
   * which is what mkvextract writes.
   */
  public static UidFormat fromAttribute(String attribute) {
    if (attribute != null && attribute.trim().equalsIgnoreCase("ascii")) {
      return ASCII;
    }
    return HEX;
  }
}
