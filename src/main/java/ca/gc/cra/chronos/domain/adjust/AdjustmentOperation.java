package ca.gc.cra.chronos.domain.adjust;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One step of an edit script that moves booked worklogs towards attendance ground truth.
 * <p><strong>Role:</strong> Transient output of the adjustment planner and input of the applier.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param type kind of correction
 * @param target record as it stands before this step
 * @param newInterval interval the target is updated to; {@code null} for {@link AdjustmentType#DELETE}
 * @param splitSecondPart record created for the part after the pause; only for {@link AdjustmentType#SPLIT}
 * @param pauseRange pause or gap that caused the step; {@code null} for envelope moves
 * @param pauseLabel label of that pause; empty for envelope moves
 * @since 0.1.0
 */
public record AdjustmentOperation(
    AdjustmentType type,
    RemoteWorklogRecord target,
    TimeInterval newInterval,
    RemoteWorklogRecord splitSecondPart,
    TimeInterval pauseRange,
    String pauseLabel) {

  /** Suffix appended to the target id for the record created by a split. */
  public static final String SPLIT_SUFFIX = "_split";

  private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

  public AdjustmentOperation {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(target, "target");
    pauseLabel = pauseLabel == null ? "" : pauseLabel;
    if (type == AdjustmentType.DELETE) {
      if (newInterval != null) {
        throw new IllegalArgumentException("delete must not carry a new interval");
      }
    } else {
      Objects.requireNonNull(newInterval, "newInterval");
    }
    if ((type == AdjustmentType.SPLIT) != (splitSecondPart != null)) {
      throw new IllegalArgumentException("only split operations carry a second part");
    }
  }

  public static AdjustmentOperation moveStart(RemoteWorklogRecord target, LocalDateTime newStart) {
    return new AdjustmentOperation(AdjustmentType.MOVE_START, target,
        new TimeInterval(newStart, target.end()), null, null, "");
  }

  public static AdjustmentOperation moveEnd(RemoteWorklogRecord target, LocalDateTime newEnd) {
    return new AdjustmentOperation(AdjustmentType.MOVE_END, target,
        new TimeInterval(target.start(), newEnd), null, null, "");
  }

  /** Extends the record preceding an unjustified gap. */
  public static AdjustmentOperation closeGap(
      RemoteWorklogRecord target, LocalDateTime newEnd, TimeInterval closed, String label) {
    return new AdjustmentOperation(AdjustmentType.MOVE_END, target,
        new TimeInterval(target.start(), newEnd), null, closed, label);
  }

  public static AdjustmentOperation shortenBefore(RemoteWorklogRecord target, TimeInterval pause, String label) {
    return new AdjustmentOperation(AdjustmentType.SHORTEN_BEFORE, target,
        new TimeInterval(target.start(), pause.start()), null, pause, label);
  }

  public static AdjustmentOperation shortenAfter(RemoteWorklogRecord target, TimeInterval pause, String label) {
    return new AdjustmentOperation(AdjustmentType.SHORTEN_AFTER, target,
        new TimeInterval(pause.end(), target.end()), null, pause, label);
  }

  public static AdjustmentOperation split(RemoteWorklogRecord target, TimeInterval pause, String label) {
    RemoteWorklogRecord second = new RemoteWorklogRecord(
        target.id() + SPLIT_SUFFIX,
        target.ticketKey(),
        target.authorId(),
        new TimeInterval(pause.end(), target.end()),
        target.comment());
    return new AdjustmentOperation(AdjustmentType.SPLIT, target,
        new TimeInterval(target.start(), pause.start()), second, pause, label);
  }

  public static AdjustmentOperation delete(RemoteWorklogRecord target, TimeInterval pause, String label) {
    return new AdjustmentOperation(AdjustmentType.DELETE, target, null, null, pause, label);
  }

  public Optional<TimeInterval> updatedInterval() {
    return Optional.ofNullable(newInterval);
  }

  public Optional<RemoteWorklogRecord> secondPart() {
    return Optional.ofNullable(splitSecondPart);
  }

  public LocalDateTime newStart() {
    return newInterval == null ? null : newInterval.start();
  }

  public Duration newDuration() {
    return newInterval == null ? Duration.ZERO : newInterval.duration();
  }

  /** Record as it stands after this step; empty for deletes. */
  public Optional<RemoteWorklogRecord> updatedRecord() {
    if (newInterval == null) {
      return Optional.empty();
    }
    return Optional.of(new RemoteWorklogRecord(
        target.id(), target.ticketKey(), target.authorId(), newInterval, target.comment()));
  }

  /** Human-readable summary, e.g. {@code ABC-1: start 08:15 -> 08:00}. */
  public String description() {
    String key = target.ticketKey();
    return switch (type) {
      case MOVE_START -> key + ": start " + hhmm(target.start()) + " -> " + hhmm(newInterval.start());
      case MOVE_END -> key + ": end " + hhmm(target.end()) + " -> " + hhmm(newInterval.end())
          + (pauseLabel.isEmpty() ? "" : " (" + pauseLabel + ")");
      case SHORTEN_BEFORE -> key + ": end " + hhmm(target.end()) + " -> " + hhmm(newInterval.end())
          + " (" + pauseLabel + " " + range(pauseRange) + ")";
      case SHORTEN_AFTER -> key + ": start " + hhmm(target.start()) + " -> " + hhmm(newInterval.start())
          + " (" + pauseLabel + " " + range(pauseRange) + ")";
      case SPLIT -> key + ": split " + range(target.interval()) + " into " + range(newInterval)
          + " and " + range(splitSecondPart.interval()) + " (" + pauseLabel + ")";
      case DELETE -> key + ": delete " + range(target.interval())
          + " (inside " + pauseLabel + " " + range(pauseRange) + ")";
    };
  }

  private static String hhmm(LocalDateTime value) {
    return HH_MM.format(value);
  }

  private static String range(TimeInterval interval) {
    return interval == null ? "" : hhmm(interval.start()) + "-" + hhmm(interval.end());
  }
}
