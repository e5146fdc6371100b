package cafe.woden.messagebot.world.api;

import java.util.Map;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Key/value persistence for player history. */
@ApplicationLayer
public interface PlayerStorage {

  /** Returns the players stored under {@code key}, or {@code fallback} if nothing is stored. */
  Map<String, PlayerInfo> load(String key, Map<String, PlayerInfo> fallback);

  void save(String key, Map<String, PlayerInfo> players);
}
