package ca.gc.cra.chronos.infrastructure.commit;

import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides the next page of a paged commit listing.
 *
 * <p>Order: a numeric {@code X-Next-Page} header, then the {@code rel="next"} entry of a {@code Link} header,
 * then a page shorter than {@code perPage} ends the listing, else the page after the current one.</p>
 *
 * @since 0.1.0
 */
public final class CommitPagination {
  /** Hard limit on pages fetched per project. */
  public static final int MAX_PAGES = 50;

  private static final Pattern NEXT_LINK =
      Pattern.compile("<([^>]*)>\\s*;\\s*rel=\"?next\"?", Pattern.CASE_INSENSITIVE);
  private static final Pattern PAGE_PARAM = Pattern.compile("[?&]page=(\\d+)");

  private CommitPagination() {
    // Utility
  }

  /**
   * Computes the page to request after {@code page}.
   *
   * @param headers response headers; names are matched case-insensitively
   * @param page current page, starting at 1
   * @param itemCount items on the current page
   * @param perPage requested page size
   * @return next page, or empty when the listing is exhausted
   */
  public static OptionalInt nextPage(Map<String, String> headers, int page, int itemCount, int perPage) {
    String next = header(headers, "X-Next-Page");
    if (next != null) {
      String trimmed = next.trim();
      if (trimmed.matches("\\d+")) {
        return OptionalInt.of(Integer.parseInt(trimmed));
      }
    }
    String link = header(headers, "Link");
    if (link != null) {
      Matcher m = NEXT_LINK.matcher(link);
      while (m.find()) {
        Matcher p = PAGE_PARAM.matcher(m.group(1));
        if (p.find()) {
          return OptionalInt.of(Integer.parseInt(p.group(1)));
        }
      }
    }
    if (itemCount < perPage) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(page + 1);
  }

  private static String header(Map<String, String> headers, String name) {
    if (headers == null) {
      return null;
    }
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
