package cafe.woden.messagebot.world;

import cafe.woden.messagebot.world.api.CommandHandler;
import cafe.woden.messagebot.world.api.DuplicateCommandException;
import cafe.woden.messagebot.world.api.Player;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chat command registry.
 *
 * <p>A chat line is a command when it is the prefix character followed directly by a non-space
 * token, optionally followed by a space and arguments. Tokens are case-insensitive.
 */
@ApplicationLayer
public class CommandRegistry {
  private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

  public static final char DEFAULT_PREFIX = '/';

  private final ConcurrentHashMap<String, CommandHandler> handlers = new ConcurrentHashMap<>();
  private final char prefix;
  private final Pattern commandShape;

  public CommandRegistry() {
    this(DEFAULT_PREFIX);
  }

  public CommandRegistry(char prefix) {
    this.prefix = prefix;
    // Arguments stop at the end of the line; multi-line chat is not a command.
    this.commandShape =
        Pattern.compile("^" + Pattern.quote(String.valueOf(prefix)) + "([^ ]+) ?(.*)$");
  }

  static String canonicalToken(String token) {
    return Objects.toString(token, "").trim().toUpperCase(Locale.ROOT);
  }

  public char prefix() {
    return prefix;
  }

  /** @throws DuplicateCommandException if the token already has a handler */
  public void register(String token, CommandHandler handler) {
    Objects.requireNonNull(handler, "handler");
    String key = canonicalToken(token);
    if (key.isEmpty()) throw new IllegalArgumentException("command is blank");
    if (handlers.putIfAbsent(key, handler) != null) {
      throw new DuplicateCommandException(key);
    }
  }

  public void unregister(String token) {
    handlers.remove(canonicalToken(token));
  }

  public boolean isRegistered(String token) {
    return handlers.containsKey(canonicalToken(token));
  }

  public List<String> tokens() {
    return List.copyOf(handlers.keySet());
  }

  public boolean looksLikeCommand(String message) {
    return message != null && commandShape.matcher(message).matches();
  }

  /**
   * Runs the handler for {@code message} if it is a registered command.
   *
   * @return true if a handler ran
   */
  public boolean dispatch(String message, Player player) {
    if (message == null) return false;
    Matcher m = commandShape.matcher(message);
    if (!m.matches()) return false;

    CommandHandler handler = handlers.get(canonicalToken(m.group(1)));
    if (handler == null) return false;

    try {
      handler.handle(player, m.group(2));
    } catch (RuntimeException e) {
      log.warn("[messagebot] command {}{} failed", prefix, m.group(1), e);
    }
    return true;
  }
}
