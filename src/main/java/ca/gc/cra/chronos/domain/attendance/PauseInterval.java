package ca.gc.cra.chronos.domain.attendance;

import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Canonical break recorded in attendance.
 *
 * @param interval break span
 * @since 0.1.0
 */
public record PauseInterval(TimeInterval interval) {
  public PauseInterval {
    Objects.requireNonNull(interval, "interval");
  }

  public static List<TimeInterval> intervals(Collection<PauseInterval> pauses) {
    List<TimeInterval> out = new ArrayList<>(pauses.size());
    for (PauseInterval pause : pauses) {
      out.add(pause.interval());
    }
    return out;
  }
}
