package cafe.woden.messagebot.world.api;

/**
 * Raw events emitted by a {@link ChatEventSource} after it has parsed the server's chat log.
 *
 * <p>Names are passed through as they appeared in the log; canonicalization is done by the world.
 */
public sealed interface ChatEvent permits
    ChatEvent.Join,
    ChatEvent.Leave,
    ChatEvent.Message,
    ChatEvent.Other {

  record Join(String name, String ip) implements ChatEvent {}

  record Leave(String name) implements ChatEvent {}

  record Message(String name, String message) implements ChatEvent {}

  /** A log line the source could not classify. */
  record Other(String line) implements ChatEvent {}
}
