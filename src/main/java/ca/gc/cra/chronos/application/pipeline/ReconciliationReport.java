package ca.gc.cra.chronos.application.pipeline;

import ca.gc.cra.chronos.domain.worklog.DraftSegment;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Everything one reconciliation pass produced.
 * <p>An invalid configuration yields a report with {@code configurationValid=false}, the problems found and no
 * drafts.</p>
 *
 * @param draftsByDay classified drafts per attendance day, ascending
 * @param outcomes per-unit results of external calls
 * @param trace human-readable pass trace
 * @param configurationValid whether the pass ran
 * @param configurationProblems missing settings when the pass did not run
 * @since 0.1.0
 */
public record ReconciliationReport(
    Map<LocalDate, List<DraftSegment>> draftsByDay,
    List<UnitOutcome> outcomes,
    List<String> trace,
    boolean configurationValid,
    List<String> configurationProblems) {

  public ReconciliationReport {
    Objects.requireNonNull(draftsByDay, "draftsByDay");
    Map<LocalDate, List<DraftSegment>> copy = new LinkedHashMap<>();
    draftsByDay.forEach((day, drafts) -> copy.put(day, List.copyOf(drafts)));
    draftsByDay = Collections.unmodifiableMap(copy);
    outcomes = List.copyOf(outcomes);
    trace = List.copyOf(trace);
    configurationProblems = List.copyOf(configurationProblems);
  }

  static ReconciliationReport invalid(List<String> problems) {
    return new ReconciliationReport(Map.of(), List.of(), List.of(), false, problems);
  }

  /** All drafts in day order. */
  public List<DraftSegment> allDrafts() {
    List<DraftSegment> all = new ArrayList<>();
    draftsByDay.values().forEach(all::addAll);
    return all;
  }

  public List<UnitOutcome> failedUnits() {
    return outcomes.stream().filter(o -> !o.ok()).toList();
  }
}
