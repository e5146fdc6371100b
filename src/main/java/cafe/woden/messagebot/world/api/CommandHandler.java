package cafe.woden.messagebot.world.api;

/** Handles one chat command. {@code args} is everything after the first space, possibly empty. */
@FunctionalInterface
public interface CommandHandler {
  void handle(Player player, String args);
}
