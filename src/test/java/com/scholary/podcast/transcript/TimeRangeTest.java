package com.scholary.podcast.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void duration_shouldBeDifferenceOfBounds() {
    assertThat(new TimeRange(12.5, 20.0).duration()).isEqualTo(7.5);
  }

  @Test
  void contains_shouldBeHalfOpen() {
    TimeRange range = new TimeRange(10, 20);

    assertThat(range.contains(10)).isTrue();
    assertThat(range.contains(19.999)).isTrue();
    assertThat(range.contains(20)).isFalse();
    assertThat(range.contains(9.999)).isFalse();
  }

  @Test
  void overlaps_shouldIgnoreTouchingRanges() {
    TimeRange first = new TimeRange(0, 10);

    assertThat(first.overlaps(new TimeRange(10, 20))).isFalse();
    assertThat(first.overlaps(new TimeRange(9.5, 20))).isTrue();
    assertThat(first.overlaps(new TimeRange(2, 3))).isTrue();
  }

  @Test
  void gapTo_shouldBeSymmetricAndZeroWhenOverlapping() {
    TimeRange first = new TimeRange(0, 10);
    TimeRange second = new TimeRange(13, 20);

    assertThat(first.gapTo(second)).isEqualTo(3.0);
    assertThat(second.gapTo(first)).isEqualTo(3.0);
    assertThat(first.gapTo(new TimeRange(5, 15))).isZero();
  }

  @Test
  void constructor_shouldRejectInvalidBounds() {
    assertThatThrownBy(() -> new TimeRange(-1, 5)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TimeRange(5, 4)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TimeRange(Double.NaN, 4))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
