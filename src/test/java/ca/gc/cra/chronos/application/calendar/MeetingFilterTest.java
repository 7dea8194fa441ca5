package ca.gc.cra.chronos.application.calendar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.chronos.domain.calendar.MeetingEvent;
import ca.gc.cra.chronos.domain.time.TimeInterval;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MeetingFilterTest {
  private static final LocalDateTime NINE = LocalDateTime.of(2024, 3, 4, 9, 0);
  private final MeetingFilter filter = MeetingFilter.withDefaultHints();

  private static MeetingEvent.Builder meeting(String title, int minutes) {
    return MeetingEvent.builder(new TimeInterval(NINE, NINE.plusMinutes(minutes)))
        .title(title)
        .attendeeCount(3);
  }

  @Test
  void plainMeetingIsAccepted() {
    assertTrue(filter.accepts(meeting("Backlog refinement", 60).build()));
  }

  @Test
  void rejectionReasonsFollowRuleOrder() {
    assertEquals(Optional.of("cancelled"),
        filter.rejectionReason(meeting("Refinement (abgesagt)", 60).build()));
    assertEquals(Optional.of("no attendees"),
        filter.rejectionReason(meeting("Refinement", 60).attendeeCount(0).build()));
    assertEquals(Optional.of("busy status FREE"),
        filter.rejectionReason(meeting("Refinement", 60).busyStatus("free").build()));
    assertEquals(Optional.of("transparent"),
        filter.rejectionReason(meeting("Refinement", 60).transparency("TRANSPARENT").build()));
    assertEquals(Optional.of("longer than 10h"),
        filter.rejectionReason(meeting("Workshop", 11 * 60).build()));
    assertEquals(Optional.of("crosses midnight"),
        filter.rejectionReason(meeting("Release", 16 * 60).build()));
    assertEquals(Optional.of("no title"), filter.rejectionReason(meeting(" ", 30).build()));
  }

  @Test
  void nonMeetingHintsMatchCaseInsensitively() {
    assertEquals(Optional.of("non-meeting hint 'focus'"),
        filter.rejectionReason(meeting("FOCUS block", 120).build()));
  }

  @Test
  void exceptionInstanceWithoutAttendeesIsKept() {
    MeetingEvent instance = meeting("Moved standup", 15)
        .attendeeCount(0)
        .recurrenceId(NINE.minusDays(1))
        .build();

    assertTrue(filter.accepts(instance));
  }

  @Test
  void selfCheckRejectsTentativeAndDeclined() {
    assertTrue(filter.acceptsForSelf(meeting("Planning", 60).selfParticipation("accepted").build()));
    assertTrue(filter.acceptsForSelf(meeting("Planning", 60).build()));
    assertFalse(filter.acceptsForSelf(meeting("Planning", 60).selfParticipation("TENTATIVE").build()));
    assertFalse(filter.acceptsForSelf(meeting("Planning", 60).selfParticipation("DECLINED").build()));
    assertTrue(filter.accepts(meeting("Planning", 60).selfParticipation("DECLINED").build()));
  }

  @Test
  void customHintsReplaceDefaults() {
    MeetingFilter custom = new MeetingFilter(List.of(" Travel ", "", "travel"));

    assertEquals(List.of("travel"), custom.hints());
    assertTrue(custom.accepts(meeting("Focus", 60).build()));
  }
}
