package cafe.woden.messagebot.world.api;

import java.util.Objects;

/** A chat line together with the player who said it. Includes lines that start with a command. */
public record PlayerMessage(Player player, String message) {
  public PlayerMessage {
    Objects.requireNonNull(player, "player");
    message = Objects.toString(message, "");
  }
}
