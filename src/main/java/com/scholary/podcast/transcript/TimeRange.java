package com.scholary.podcast.transcript;

/**
 * Represents a half-open time range {@code [start, end)} in seconds.
 *
 * <p>Used for transcript chunks, key segment source spans and excerpt windows. All times are in
 * seconds with fractional precision.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (Double.isNaN(start) || Double.isNaN(end)) {
      throw new IllegalArgumentException("Time range bounds must be numbers");
    }
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Check if this range contains a given time point.
   *
   * @param time the time to check
   * @return true if time is within [start, end)
   */
  public boolean contains(double time) {
    return time >= start && time < end;
  }

  /**
   * Check if this range overlaps with another range. Ranges that only touch do not overlap.
   *
   * @param other the other range
   * @return true if the ranges share any time
   */
  public boolean overlaps(TimeRange other) {
    return this.start < other.end && other.start < this.end;
  }

  /**
   * Distance in seconds between two ranges; zero when they touch or overlap.
   *
   * @param other the other range
   * @return the gap between the ranges
   */
  public double gapTo(TimeRange other) {
    return Math.max(0, Math.max(other.start - this.end, this.start - other.end));
  }
}
