package ca.gc.cra.chronos.domain.attendance;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Confirmed attendance interval, already net of regular breaks.
 *
 * @param interval attendance span
 * @since 0.1.0
 */
public record WorkWindow(TimeInterval interval) {
  public WorkWindow {
    Objects.requireNonNull(interval, "interval");
  }

  public static List<TimeInterval> intervals(Collection<WorkWindow> windows) {
    List<TimeInterval> out = new ArrayList<>(windows.size());
    for (WorkWindow window : windows) {
      out.add(window.interval());
    }
    return out;
  }

  public static List<WorkWindow> of(Collection<TimeInterval> intervals) {
    List<WorkWindow> out = new ArrayList<>(intervals.size());
    for (TimeInterval interval : intervals) {
      out.add(new WorkWindow(interval));
    }
    return out;
  }
}
