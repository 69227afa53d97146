package com.scholary.unlinkmkv.timecode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A non-negative Matroska timecode with nanosecond resolution.
 *
 * <p>Stored as a whole number of nanoseconds so that additions are exact. The textual form used in
 * chapter files and on the mkvmerge command line is {@code HH:MM:SS.nnnnnnnnn}; hours are
 * unbounded and minutes/seconds always stay below 60 because they are derived from the nanosecond
 * count.
 */
public record Timecode(long nanos) implements Comparable<Timecode> {

  public static final Timecode ZERO = new Timecode(0L);

  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
  private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;

  // Example: 01:02:03.456000000 (fraction optional, up to 9 digits)
  private static final Pattern TIMECODE_PATTERN =
      Pattern.compile("^(\\d+):([0-5]?\\d):([0-5]?\\d)(?:\\.(\\d{1,9}))?$");

  public Timecode {
    if (nanos < 0) {
      throw new IllegalArgumentException("Timecode cannot be negative: " + nanos);
    }
  }

  public static Timecode ofNanos(long nanos) {
    return new Timecode(nanos);
  }

  public static Timecode ofSeconds(long seconds) {
    return new Timecode(Math.multiplyExact(seconds, NANOS_PER_SECOND));
  }

  /**
   * Parse a {@code HH:MM:SS[.fraction]} timecode.
   *
   * <p>Fractions shorter than nine digits are right-padded, so {@code 00:00:01.5} is one and a half
   * seconds.
   *
   * @param text the timecode text, surrounding whitespace is ignored
   * @return the parsed timecode
   * @throws IllegalArgumentException if the text is not a valid timecode
   */
  public static Timecode parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Timecode text must not be null");
    }
    Matcher matcher = TIMECODE_PATTERN.matcher(text.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid timecode: '" + text + "'");
    }

    long hours = Long.parseLong(matcher.group(1));
    long minutes = Long.parseLong(matcher.group(2));
    long seconds = Long.parseLong(matcher.group(3));
    String fraction = matcher.group(4);
    long fractionNanos = 0;
    if (fraction != null) {
      StringBuilder padded = new StringBuilder(fraction);
      while (padded.length() < 9) {
        padded.append('0');
      }
      fractionNanos = Long.parseLong(padded.toString());
    }

    long total =
        Math.addExact(
            Math.multiplyExact(hours, NANOS_PER_HOUR),
            minutes * NANOS_PER_MINUTE + seconds * NANOS_PER_SECOND + fractionNanos);
    return new Timecode(total);
  }

  public Timecode plus(Timecode other) {
    return new Timecode(Math.addExact(nanos, other.nanos));
  }

  /**
   * Subtract another timecode.
   *
   * @throws IllegalArgumentException if {@code other} is later than this timecode
   */
  public Timecode minus(Timecode other) {
    if (other.nanos > nanos) {
      throw new IllegalArgumentException(
          String.format("Cannot subtract %s from earlier timecode %s", other, this));
    }
    return new Timecode(nanos - other.nanos);
  }

  public boolean isZero() {
    return nanos == 0;
  }

  public boolean isBefore(Timecode other) {
    return nanos < other.nanos;
  }

  public boolean isAfter(Timecode other) {
    return nanos > other.nanos;
  }

  @Override
  public int compareTo(Timecode other) {
    return Long.compare(nanos, other.nanos);
  }

  @Override
  public String toString() {
    long hours = nanos / NANOS_PER_HOUR;
    long minutes = (nanos % NANOS_PER_HOUR) / NANOS_PER_MINUTE;
    long seconds = (nanos % NANOS_PER_MINUTE) / NANOS_PER_SECOND;
    long fraction = nanos % NANOS_PER_SECOND;
    return String.format("%02d:%02d:%02d.%09d", hours, minutes, seconds, fraction);
  }
}
