package com.scholary.unlinkmkv.timecode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimecodeTest {

  @Test
  void parse_shouldReadFullNanosecondTimecode() {
    Timecode timecode = Timecode.parse("01:02:03.456000000");

    assertThat(timecode.nanos()).isEqualTo(3_723_456_000_000L);
    assertThat(timecode.toString()).isEqualTo("01:02:03.456000000");
  }

  @Test
  void parse_shouldPadShortFractions() {
    assertThat(Timecode.parse("00:00:01.5")).isEqualTo(Timecode.ofNanos(1_500_000_000L));
    assertThat(Timecode.parse("00:00:07")).isEqualTo(Timecode.ofSeconds(7));
  }

  @Test
  void parse_shouldAllowHoursBeyondTwoDigits() {
    Timecode timecode = Timecode.parse("123:00:00.000000000");

    assertThat(timecode.toString()).isEqualTo("123:00:00.000000000");
  }

  @Test
  void parse_shouldRejectMalformedText() {
    assertThatThrownBy(() -> Timecode.parse("1:2")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Timecode.parse("00:61:00"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Timecode.parse("00:00:00.1234567890"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Timecode.parse(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void plus_shouldCarryIntoMinutesAndHours() {
    Timecode sum = Timecode.parse("00:59:59.900000000").plus(Timecode.parse("00:00:00.200000000"));

    assertThat(sum.toString()).isEqualTo("01:00:00.100000000");
  }

  @Test
  void plus_shouldHaveZeroAsIdentity() {
    Timecode timecode = Timecode.parse("00:23:40.040000000");

    assertThat(timecode.plus(Timecode.ZERO)).isEqualTo(timecode);
    assertThat(Timecode.ZERO.plus(timecode)).isEqualTo(timecode);
  }

  @Test
  void plus_shouldBeCommutativeAndAssociative() {
    Timecode a = Timecode.parse("00:01:30.5");
    Timecode b = Timecode.parse("00:22:10.123456789");
    Timecode c = Timecode.parse("02:00:00.000000001");

    assertThat(a.plus(b)).isEqualTo(b.plus(a));
    assertThat(a.plus(b).plus(c)).isEqualTo(a.plus(b.plus(c)));
  }

  @Test
  void toString_shouldRoundTripThroughParse() {
    Timecode timecode = Timecode.ofNanos(86_399_999_999_999L);

    assertThat(Timecode.parse(timecode.toString())).isEqualTo(timecode);
  }

  @Test
  void minus_shouldRejectNegativeResults() {
    Timecode one = Timecode.ofSeconds(1);
    Timecode two = Timecode.ofSeconds(2);

    assertThat(two.minus(one)).isEqualTo(one);
    assertThatThrownBy(() -> one.minus(two)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void compareTo_shouldOrderByDuration() {
    assertThat(Timecode.ofSeconds(1)).isLessThan(Timecode.ofSeconds(2));
    assertThat(Timecode.ofSeconds(3).isAfter(Timecode.ofSeconds(2))).isTrue();
    assertThat(Timecode.ZERO.isZero()).isTrue();
  }
}
