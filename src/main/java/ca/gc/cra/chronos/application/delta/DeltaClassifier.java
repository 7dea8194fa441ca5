package ca.gc.cra.chronos.application.delta;

import ca.gc.cra.chronos.domain.worklog.DeltaState;
import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import ca.gc.cra.chronos.domain.worklog.RemoteWorklogRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Tags drafts as {@link DeltaState#NEW}, {@link DeltaState#DUPLICATE} or
 * {@link DeltaState#OVERLAP} against worklogs already booked on the same ticket.
 * <p><strong>Rules:</strong> Only records with the draft's ticket key are considered. A record overlapping
 * the draft whose duration differs by at most one minute and whose start differs by at most five minutes
 * makes the draft a duplicate; the first such record ends the scan. Any other overlap makes it an
 * overlap; no overlap leaves it new.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DeltaClassifier {
  static final Duration DURATION_TOLERANCE = Duration.ofSeconds(60);
  static final Duration START_TOLERANCE = Duration.ofMinutes(5);

  public DeltaState classify(DraftSegment draft, Collection<RemoteWorklogRecord> records) {
    Objects.requireNonNull(draft, "draft");
    Objects.requireNonNull(records, "records");
    boolean overlapping = false;
    for (RemoteWorklogRecord record : records) {
      if (!record.ticketKey().equalsIgnoreCase(draft.ticketKey())) {
        continue;
      }
      if (!record.interval().overlaps(draft.interval())) {
        continue;
      }
      Duration durationDelta = record.duration().minus(draft.duration()).abs();
      Duration startDelta = Duration.between(record.start(), draft.interval().start()).abs();
      if (durationDelta.compareTo(DURATION_TOLERANCE) <= 0 && startDelta.compareTo(START_TOLERANCE) <= 0) {
        return DeltaState.DUPLICATE;
      }
      overlapping = true;
    }
    return overlapping ? DeltaState.OVERLAP : DeltaState.NEW;
  }

  /** Returns copies of {@code drafts} carrying their classification. */
  public List<DraftSegment> classifyAll(List<DraftSegment> drafts, Collection<RemoteWorklogRecord> records) {
    List<DraftSegment> out = new ArrayList<>(drafts.size());
    for (DraftSegment draft : drafts) {
      out.add(draft.withState(classify(draft, records)));
    }
    return out;
  }
}
