package ca.gc.cra.chronos.domain.time;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Half-open interval {@code [start, end)} of local wall-clock time.
 * <p><strong>Why:</strong> Every window the engine handles (attendance, meetings, pauses, bookings) is expressed
 * as one of these so that the interval algebra works uniformly.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param start inclusive start
 * @param end exclusive end; strictly after {@code start}
 * @since 0.1.0
 */
public record TimeInterval(LocalDateTime start, LocalDateTime end) implements Comparable<TimeInterval> {

  /**
   * Validates the interval bounds.
   *
   * @throws NullPointerException if either bound is {@code null}
   * @throws IllegalArgumentException if {@code end} is not after {@code start}
   */
  public TimeInterval {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start (" + start + " .. " + end + ")");
    }
  }

  public static TimeInterval of(LocalDateTime start, LocalDateTime end) {
    return new TimeInterval(start, end);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  /**
   * Strict half-open intersection test; intervals that only touch do not overlap.
   *
   * @param other interval to compare against
   * @return {@code true} when {@code end > other.start && other.end > start}
   */
  public boolean overlaps(TimeInterval other) {
    Objects.requireNonNull(other, "other");
    return end.isAfter(other.start) && other.end.isAfter(start);
  }

  public boolean contains(LocalDateTime instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  /** Returns {@code true} when {@code other} lies completely within this interval. */
  public boolean encloses(TimeInterval other) {
    return !other.start.isBefore(start) && !other.end.isAfter(end);
  }

  /**
   * Returns the overlapping part of both intervals.
   *
   * @param other interval to intersect with
   * @return intersection, or empty when the intervals do not overlap
   */
  public Optional<TimeInterval> intersection(TimeInterval other) {
    LocalDateTime s = start.isAfter(other.start) ? start : other.start;
    LocalDateTime e = end.isBefore(other.end) ? end : other.end;
    return e.isAfter(s) ? Optional.of(new TimeInterval(s, e)) : Optional.empty();
  }

  public TimeInterval withStart(LocalDateTime newStart) {
    return new TimeInterval(newStart, end);
  }

  public TimeInterval withEnd(LocalDateTime newEnd) {
    return new TimeInterval(start, newEnd);
  }

  @Override
  public int compareTo(TimeInterval other) {
    int byStart = start.compareTo(other.start);
    return byStart != 0 ? byStart : end.compareTo(other.end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
