package cafe.woden.messagebot.config;

import java.util.List;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * MessageBot configuration.
 *
 * <p>Example YAML:
 * <pre>
 * messagebot:
 *   world:
 *     command-prefix: "/"
 *   storage:
 *     file: /var/lib/messagebot/players.yml
 *   responder:
 *     announcement-delay-minutes: 5
 *     join:
 *       - message: "Welcome back {{Name}}!"
 *         joins-low: 2
 * </pre>
 */
@ConfigurationProperties(prefix = "messagebot")
public record MessageBotProperties(World world, Storage storage, Responder responder) {

  /** Settings for the world model itself. */
  public record World(Character commandPrefix, String playersKey, Boolean loadOnStart) {

    public static World defaults() {
      return new World(null, null, null);
    }

    public World {
      if (commandPrefix == null || Character.isWhitespace(commandPrefix)) commandPrefix = '/';
      if (playersKey == null || playersKey.isBlank()) playersKey = "mb_players";
      if (loadOnStart == null) loadOnStart = Boolean.TRUE;
    }
  }

  /**
   * YAML-file persistence for player history.
   *
   * <p>With {@code autosave} on, the registry is written {@code autosaveDelayMs} after the last
   * change in a burst.
   */
  public record Storage(String file, Boolean autosave, Long autosaveDelayMs) {
    public Storage {
      if (file == null || file.isBlank()) {
        file = System.getProperty("user.home") + "/.config/messagebot/players.yml";
      }
      if (autosave == null) autosave = Boolean.TRUE;
      if (autosaveDelayMs == null || autosaveDelayMs < 0) autosaveDelayMs = 2_000L;
    }
  }

  /**
   * Canned replies to joins, leaves and chat triggers, plus rotating announcements.
   *
   * <p>{@code regexTriggers} switches trigger matching from wildcard ({@code *}) to regular
   * expressions.
   */
  public record Responder(
      Boolean enabled,
      Integer announcementDelayMinutes,
      Boolean regexTriggers,
      List<Rule> join,
      List<Rule> leave,
      List<Rule> trigger,
      List<String> announcements) {

    public Responder {
      if (enabled == null) enabled = Boolean.TRUE;
      if (announcementDelayMinutes == null || announcementDelayMinutes <= 0) {
        announcementDelayMinutes = 10;
      }
      if (regexTriggers == null) regexTriggers = Boolean.FALSE;
      join = join == null ? List.of() : List.copyOf(join);
      leave = leave == null ? List.of() : List.copyOf(leave);
      trigger = trigger == null ? List.of() : List.copyOf(trigger);
      announcements =
          announcements == null
              ? List.of()
              : announcements.stream().filter(Objects::nonNull).filter(s -> !s.isBlank()).toList();
    }
  }

  /**
   * One responder rule.
   *
   * <p>The rule applies to players in {@code group} who are not in {@code notGroup} and whose join
   * count is within {@code [joinsLow, joinsHigh]}. Groups are {@code all}, {@code staff}, {@code
   * mod}, {@code admin}, {@code owner} and {@code nobody}. {@code trigger} is only used by trigger
   * rules.
   */
  public record Rule(
      String message,
      String trigger,
      String group,
      String notGroup,
      Integer joinsLow,
      Integer joinsHigh) {
    public Rule {
      message = Objects.toString(message, "");
      trigger = Objects.toString(trigger, "");
      if (group == null || group.isBlank()) group = "all";
      if (notGroup == null || notGroup.isBlank()) notGroup = "nobody";
      if (joinsLow == null || joinsLow < 0) joinsLow = 0;
      if (joinsHigh == null) joinsHigh = 9999;
      if (joinsHigh < joinsLow) joinsHigh = joinsLow;
    }
  }

  public MessageBotProperties {
    if (world == null) world = World.defaults();
    if (storage == null) storage = new Storage(null, null, null);
    if (responder == null) responder = new Responder(null, null, null, null, null, null, null);
  }
}
