package cafe.woden.messagebot.world.api;

import io.reactivex.rxjava3.core.Flowable;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Tails the server chat log and turns lines into {@link ChatEvent}s.
 *
 * <p>The source also tracks who is online. The set returned by {@link #online()} is live and shared:
 * the world adds names it learns from the server overview but never removes any.
 */
@ApplicationLayer
public interface ChatEventSource {

  /** Events in the order they were read from the log. */
  Flowable<ChatEvent> events();

  OnlinePlayers online();
}
