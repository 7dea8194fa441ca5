package ca.gc.cra.chronos.domain.time;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * <strong>What:</strong> Subtract, merge and clip primitives over {@link TimeInterval}s.
 * <p><strong>Why:</strong> Attendance, meeting and pause handling all reduce to these operations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Cut intervals out of a base interval, discarding noise below {@link #MIN_PIECE}.</li>
 *   <li>Merge attendance windows where touching endpoints join ({@link #mergeTouching}).</li>
 *   <li>Merge meeting windows where only a strict overlap joins ({@link #mergeOverlapping}).</li>
 * </ul>
 * <p>The two merge policies are intentionally separate; callers pick the one that matches the
 * kind of window they hold.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class IntervalAlgebra {
  /** Pieces shorter than this are treated as noise and dropped. */
  public static final Duration MIN_PIECE = Duration.ofSeconds(60);

  private IntervalAlgebra() {
    // Utility
  }

  /**
   * Returns the parts of {@code base} not covered by any cutter, ordered by start.
   *
   * <p>Each cutter is applied to the current remainder set in turn; an overlapping remainder is
   * replaced by its left and right leftovers. Pieces under {@link #MIN_PIECE} are dropped from the
   * final result, which makes the outcome independent of cutter order.</p>
   *
   * @param base interval to cut from
   * @param cutters intervals to remove; may be empty
   * @return ordered remainder pieces
   */
  public static List<TimeInterval> subtract(TimeInterval base, Collection<TimeInterval> cutters) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(cutters, "cutters");
    List<TimeInterval> pieces = new ArrayList<>();
    pieces.add(base);
    for (TimeInterval cutter : cutters) {
      List<TimeInterval> next = new ArrayList<>(pieces.size() + 1);
      for (TimeInterval piece : pieces) {
        if (!piece.overlaps(cutter)) {
          next.add(piece);
          continue;
        }
        if (cutter.start().isAfter(piece.start())) {
          next.add(new TimeInterval(piece.start(), cutter.start()));
        }
        if (cutter.end().isBefore(piece.end())) {
          next.add(new TimeInterval(cutter.end(), piece.end()));
        }
      }
      pieces = next;
    }
    List<TimeInterval> result = new ArrayList<>(pieces.size());
    for (TimeInterval piece : pieces) {
      if (piece.duration().compareTo(MIN_PIECE) >= 0) {
        result.add(piece);
      }
    }
    result.sort(Comparator.naturalOrder());
    return result;
  }

  /**
   * Subtracts the cutters from every base interval and concatenates the results in start order.
   *
   * @param bases intervals to cut from
   * @param cutters intervals to remove
   * @return ordered remainder pieces of all bases
   */
  public static List<TimeInterval> subtractAll(
      Collection<TimeInterval> bases, Collection<TimeInterval> cutters) {
    List<TimeInterval> result = new ArrayList<>();
    for (TimeInterval base : bases) {
      result.addAll(subtract(base, cutters));
    }
    result.sort(Comparator.naturalOrder());
    return result;
  }

  /**
   * Attendance merge: sorts by start and unions intervals where {@code next.start <= last.end}.
   *
   * @param intervals windows to merge
   * @return merged, ordered, non-touching windows
   */
  public static List<TimeInterval> mergeTouching(Collection<TimeInterval> intervals) {
    return merge(intervals, Function.identity(), IntervalAlgebra::span, true);
  }

  /**
   * Touching merge over arbitrary values carrying an interval.
   *
   * @param values values to merge
   * @param intervalOf extracts the interval of a value
   * @param combiner joins the previously merged value with the touching or overlapping next one
   * @param <T> value type
   * @return merged values in start order
   */
  public static <T> List<T> mergeTouching(
      Collection<T> values, Function<T, TimeInterval> intervalOf, BinaryOperator<T> combiner) {
    return merge(values, intervalOf, combiner, true);
  }

  /**
   * Meeting merge: sorts by start and unions intervals only where {@code next.start < last.end}.
   * Two intervals that touch exactly stay separate.
   *
   * @param intervals windows to merge
   * @return merged, ordered windows
   */
  public static List<TimeInterval> mergeOverlapping(Collection<TimeInterval> intervals) {
    return mergeOverlapping(intervals, Function.identity(), IntervalAlgebra::span);
  }

  /**
   * Strict-overlap merge over arbitrary values carrying an interval.
   *
   * @param values values to merge
   * @param intervalOf extracts the interval of a value
   * @param combiner joins the previously merged value with the overlapping next one
   * @param <T> value type
   * @return merged values in start order
   */
  public static <T> List<T> mergeOverlapping(
      Collection<T> values, Function<T, TimeInterval> intervalOf, BinaryOperator<T> combiner) {
    return merge(values, intervalOf, combiner, false);
  }

  /**
   * Returns the intersection of two intervals.
   *
   * @param a first interval
   * @param b second interval
   * @return overlapping part, or empty when the intervals do not overlap
   */
  public static Optional<TimeInterval> clip(TimeInterval a, TimeInterval b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    return a.intersection(b);
  }

  /** Smallest interval covering both arguments. */
  public static TimeInterval span(TimeInterval a, TimeInterval b) {
    LocalDateTime start = a.start().isBefore(b.start()) ? a.start() : b.start();
    LocalDateTime end = a.end().isAfter(b.end()) ? a.end() : b.end();
    return new TimeInterval(start, end);
  }

  public static Duration totalDuration(Collection<TimeInterval> intervals) {
    Duration total = Duration.ZERO;
    for (TimeInterval interval : intervals) {
      total = total.plus(interval.duration());
    }
    return total;
  }

  private static <T> List<T> merge(
      Collection<T> values,
      Function<T, TimeInterval> intervalOf,
      BinaryOperator<T> combiner,
      boolean joinTouching) {
    Objects.requireNonNull(values, "values");
    List<T> sorted = new ArrayList<>(values);
    sorted.sort(Comparator.comparing(intervalOf));
    List<T> merged = new ArrayList<>(sorted.size());
    for (T value : sorted) {
      if (merged.isEmpty()) {
        merged.add(value);
        continue;
      }
      T last = merged.get(merged.size() - 1);
      LocalDateTime lastEnd = intervalOf.apply(last).end();
      LocalDateTime nextStart = intervalOf.apply(value).start();
      boolean joins = joinTouching ? !nextStart.isAfter(lastEnd) : nextStart.isBefore(lastEnd);
      if (joins) {
        merged.set(merged.size() - 1, combiner.apply(last, value));
      } else {
        merged.add(value);
      }
    }
    return merged;
  }
}
