package cafe.woden.messagebot.world;

import cafe.woden.messagebot.world.api.PlayerInfo;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Player history keyed by canonical name.
 *
 * <p>Writes come from the world's event path only. Readers may call {@link #get(String)} from any
 * thread: records are immutable and swapped whole, so a reader never sees a half-updated one.
 * Entries are never removed.
 */
@ApplicationLayer
public class PlayerRegistry {

  private final ConcurrentHashMap<String, PlayerInfo> players = new ConcurrentHashMap<>();

  private final FlowableProcessor<String> changes =
      PublishProcessor.<String>create().toSerialized();

  public PlayerRegistry() {}

  public PlayerRegistry(Map<String, PlayerInfo> seed) {
    if (seed == null) return;
    for (Map.Entry<String, PlayerInfo> e : seed.entrySet()) {
      String key = canonicalName(e.getKey());
      if (key.isEmpty() || e.getValue() == null) continue;
      players.merge(key, e.getValue(), PlayerRegistry::mergeDuplicates);
    }
  }

  /** Case-folds a player name to the key used for all player state. */
  public static String canonicalName(String name) {
    return Objects.toString(name, "").trim().toUpperCase(Locale.ROOT);
  }

  /** Existing record, or {@link PlayerInfo#EMPTY} without storing anything. */
  public PlayerInfo get(String name) {
    return players.getOrDefault(canonicalName(name), PlayerInfo.EMPTY);
  }

  public boolean contains(String name) {
    return players.containsKey(canonicalName(name));
  }

  public PlayerInfo recordJoin(String name, String address) {
    String key = canonicalName(name);
    if (key.isEmpty()) return PlayerInfo.EMPTY;
    PlayerInfo next =
        players.compute(key, (k, prev) -> (prev == null ? PlayerInfo.EMPTY : prev).withJoin(address));
    changes.onNext(key);
    return next;
  }

  public PlayerInfo markOwner(String name) {
    String key = canonicalName(name);
    if (key.isEmpty()) return PlayerInfo.EMPTY;
    PlayerInfo prev = players.get(key);
    if (prev != null && prev.owner()) return prev;
    PlayerInfo next =
        players.compute(key, (k, cur) -> (cur == null ? PlayerInfo.EMPTY : cur).asOwner());
    changes.onNext(key);
    return next;
  }

  /** Canonical names of every player ever recorded. */
  public List<String> names() {
    return List.copyOf(players.keySet());
  }

  public Map<String, PlayerInfo> snapshot() {
    return new LinkedHashMap<>(players);
  }

  public int size() {
    return players.size();
  }

  /** Canonical names whose record was just replaced. */
  public Flowable<String> changes() {
    return changes.onBackpressureBuffer();
  }

  // Stored data may hold the same player under two spellings from older versions.
  private static PlayerInfo mergeDuplicates(PlayerInfo a, PlayerInfo b) {
    LinkedHashSet<String> ips = new LinkedHashSet<>(a.ips());
    ips.addAll(b.ips());
    return new PlayerInfo(
        b.ip().isEmpty() ? a.ip() : b.ip(),
        List.copyOf(ips),
        a.joins() + b.joins(),
        a.owner() || b.owner());
  }
}
