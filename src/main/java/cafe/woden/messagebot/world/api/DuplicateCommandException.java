package cafe.woden.messagebot.world.api;

/** Thrown when a command token is registered twice. The first registration stays active. */
public class DuplicateCommandException extends IllegalStateException {

  private final String command;

  public DuplicateCommandException(String command) {
    super("The command \"" + command + "\" has already been added.");
    this.command = command;
  }

  public String command() {
    return command;
  }
}
