package cafe.woden.messagebot.responder;

import cafe.woden.messagebot.world.api.Player;
import java.util.Locale;
import java.util.Objects;

/**
 * Fills player placeholders in a canned message.
 *
 * <p>Supported: {@code {{NAME}}} (as stored), {@code {{name}}} (lower case), {@code {{Name}}}
 * (first letter kept, rest lower case) and {@code {{ip}}} (most recent address).
 */
public final class MessageTemplate {

  private MessageTemplate() {}

  public static String render(String template, Player player) {
    String out = Objects.toString(template, "");
    if (player == null || out.indexOf("{{") < 0) return out;

    String name = player.getName();
    out = out.replace("{{NAME}}", name);
    out = out.replace("{{name}}", name.toLowerCase(Locale.ROOT));
    out = out.replace("{{Name}}", capitalize(name));
    out = out.replace("{{ip}}", player.getIp());
    return out;
  }

  static String capitalize(String name) {
    if (name == null || name.isEmpty()) return "";
    return name.substring(0, 1) + name.substring(1).toLowerCase(Locale.ROOT);
  }
}
