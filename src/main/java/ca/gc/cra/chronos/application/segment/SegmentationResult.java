package ca.gc.cra.chronos.application.segment;

import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Drafts of one day plus the trace lines explaining how they were cut.
 *
 * @param date day
 * @param drafts drafts sorted by start, pairwise non-overlapping
 * @param trace human-readable trace, in order
 * @param droppedPieces leftover pieces without an attributable ticket
 * @since 0.1.0
 */
public record SegmentationResult(LocalDate date, List<DraftSegment> drafts, List<String> trace, int droppedPieces) {
  public SegmentationResult {
    Objects.requireNonNull(date, "date");
    drafts = List.copyOf(drafts);
    trace = List.copyOf(trace);
  }
}
