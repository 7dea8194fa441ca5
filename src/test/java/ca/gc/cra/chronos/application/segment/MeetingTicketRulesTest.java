package ca.gc.cra.chronos.application.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class MeetingTicketRulesTest {

  @Test
  void firstMatchingPatternWinsOtherwiseDefault() {
    MeetingTicketRules rules = new MeetingTicketRules(List.of(
        new MeetingTicketRules.Rule("Retro", "team-7"),
        new MeetingTicketRules.Rule("retrospective", "OTHER-1")), "meet-1");

    assertEquals("TEAM-7", rules.ticketFor("Sprint retrospective"));
    assertEquals("MEET-1", rules.ticketFor("Planning"));
    assertEquals("MEET-1", rules.ticketFor(null));
  }

  @Test
  void invalidTicketKeyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MeetingTicketRules(List.of(), "not a key"));
  }
}
