package ca.gc.cra.chronos.application.segment;

import ca.gc.cra.chronos.validation.Strings;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ordered title-substring rules routing meetings to tickets, with a default ticket.
 *
 * <p>The first rule whose pattern occurs in the title (case-insensitively) wins.</p>
 *
 * @since 0.1.0
 */
public final class MeetingTicketRules {
  /** Title fragment and the ticket meetings carrying it are booked on. */
  public record Rule(String pattern, String ticketKey) {
    public Rule {
      pattern = Strings.requireNonBlank("pattern", pattern).toLowerCase(Locale.ROOT);
      ticketKey = Strings.requireTicketKey("ticketKey", ticketKey);
    }
  }

  private final List<Rule> rules;
  private final String defaultTicket;

  public MeetingTicketRules(List<Rule> rules, String defaultTicket) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    this.defaultTicket = Strings.requireTicketKey("defaultTicket", defaultTicket);
  }

  public String defaultTicket() {
    return defaultTicket;
  }

  public List<Rule> rules() {
    return rules;
  }

  public String ticketFor(String title) {
    String lower = title == null ? "" : title.toLowerCase(Locale.ROOT);
    for (Rule rule : rules) {
      if (lower.contains(rule.pattern())) {
        return rule.ticketKey();
      }
    }
    return defaultTicket;
  }
}
