package cafe.woden.messagebot.responder;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Case-insensitive trigger matching against a chat line.
 *
 * <p>In wildcard mode {@code *} matches any run of characters and everything else is literal, so
 * {@code te*st} matches both "test" and "tea stuff". In regex mode the trigger is used as a
 * pattern. Either way a match anywhere in the line counts.
 */
final class TriggerMatcher {
  private static final Logger log = LoggerFactory.getLogger(TriggerMatcher.class);

  private static final TriggerMatcher NEVER = new TriggerMatcher("", null);

  private final String trigger;
  private final Pattern pattern;

  private TriggerMatcher(String trigger, Pattern pattern) {
    this.trigger = trigger;
    this.pattern = pattern;
  }

  static TriggerMatcher compile(String trigger, boolean regex) {
    String t = Objects.toString(trigger, "");
    if (t.isEmpty()) return NEVER;
    if (!regex) {
      return new TriggerMatcher(t, Pattern.compile(wildcardToRegex(t), Pattern.CASE_INSENSITIVE));
    }
    try {
      return new TriggerMatcher(t, Pattern.compile(t, Pattern.CASE_INSENSITIVE));
    } catch (PatternSyntaxException e) {
      log.warn("[messagebot] ignoring trigger with invalid pattern: {}", t, e);
      return NEVER;
    }
  }

  boolean matches(String message) {
    if (pattern == null || message == null) return false;
    return pattern.matcher(message).find();
  }

  String trigger() {
    return trigger;
  }

  private static String wildcardToRegex(String trigger) {
    StringBuilder sb = new StringBuilder();
    int start = 0;
    int star;
    while ((star = trigger.indexOf('*', start)) >= 0) {
      if (star > start) sb.append(Pattern.quote(trigger.substring(start, star)));
      sb.append(".*");
      start = star + 1;
    }
    if (start < trigger.length()) sb.append(Pattern.quote(trigger.substring(start)));
    return sb.toString();
  }
}
