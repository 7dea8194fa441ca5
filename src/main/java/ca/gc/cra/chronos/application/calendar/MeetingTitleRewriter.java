package ca.gc.cra.chronos.application.calendar;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces configured trigger words in meeting titles with one of several alternatives.
 *
 * <p>Rules are tried in order; the first whose trigger occurs (case-insensitively) rewrites every
 * occurrence of it with a replacement drawn from the injected {@link Random}.</p>
 *
 * @since 0.1.0
 */
public final class MeetingTitleRewriter {
  /** Trigger text and the replacements it may be rewritten to. */
  public record Rule(String trigger, List<String> replacements) {
    public Rule {
      Objects.requireNonNull(trigger, "trigger");
      if (trigger.isBlank()) {
        throw new IllegalArgumentException("trigger must not be blank");
      }
      replacements = List.copyOf(Objects.requireNonNull(replacements, "replacements"));
      if (replacements.isEmpty()) {
        throw new IllegalArgumentException("rule '" + trigger + "' needs at least one replacement");
      }
    }
  }

  /** Result of a rewrite; {@code originalTitle} is set only when the title changed. */
  public record Rewrite(String title, Optional<String> originalTitle) {
    public boolean changed() {
      return originalTitle.isPresent();
    }
  }

  private final List<Rule> rules;
  private final Random random;

  public MeetingTitleRewriter(List<Rule> rules, Random random) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    this.random = Objects.requireNonNull(random, "random");
  }

  public static MeetingTitleRewriter none() {
    return new MeetingTitleRewriter(List.of(), new Random());
  }

  public Rewrite rewrite(String title) {
    if (title == null || title.isEmpty()) {
      return new Rewrite(title == null ? "" : title, Optional.empty());
    }
    String lower = title.toLowerCase(Locale.ROOT);
    for (Rule rule : rules) {
      if (!lower.contains(rule.trigger().toLowerCase(Locale.ROOT))) {
        continue;
      }
      String replacement = rule.replacements().get(random.nextInt(rule.replacements().size()));
      String rewritten = Pattern.compile(Pattern.quote(rule.trigger()),
              Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
          .matcher(title)
          .replaceAll(Matcher.quoteReplacement(replacement));
      return rewritten.equals(title)
          ? new Rewrite(title, Optional.empty())
          : new Rewrite(rewritten, Optional.of(title));
    }
    return new Rewrite(title, Optional.empty());
  }
}
