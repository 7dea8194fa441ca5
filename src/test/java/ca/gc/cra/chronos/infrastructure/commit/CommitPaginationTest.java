package ca.gc.cra.chronos.infrastructure.commit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class CommitPaginationTest {

  @Test
  void numericNextPageHeaderWins() {
    Map<String, String> headers = Map.of(
        "x-next-page", " 4 ",
        "Link", "<https://git.example.org/api/commits?page=9>; rel=\"next\"");

    assertEquals(OptionalInt.of(4), CommitPagination.nextPage(headers, 3, 100, 100));
  }

  @Test
  void linkHeaderNextRelationIsFollowed() {
    Map<String, String> headers = Map.of(
        "X-Next-Page", "",
        "link", "<https://git.example.org/api/commits?per_page=100&page=9>; rel=\"last\", "
            + "<https://git.example.org/api/commits?per_page=100&page=3>; rel=\"next\"");

    assertEquals(OptionalInt.of(3), CommitPagination.nextPage(headers, 2, 10, 100));
  }

  @Test
  void shortPageEndsListingWithoutHints() {
    assertTrue(CommitPagination.nextPage(Map.of(), 1, 99, 100).isEmpty());
    assertTrue(CommitPagination.nextPage(null, 1, 0, 100).isEmpty());
  }

  @Test
  void fullPageWithoutHintsAdvances() {
    assertEquals(OptionalInt.of(2), CommitPagination.nextPage(Map.of(), 1, 100, 100));
  }
}
