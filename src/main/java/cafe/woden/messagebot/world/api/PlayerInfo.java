package cafe.woden.messagebot.world.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Accumulated history for one player identity.
 *
 * <p>Instances are immutable; every change produces a new value that replaces the old one.
 */
@ValueObject
public record PlayerInfo(String ip, List<String> ips, int joins, boolean owner) {

  public static final PlayerInfo EMPTY = new PlayerInfo("", List.of(), 0, false);

  public PlayerInfo {
    ip = Objects.toString(ip, "");
    ips = ips == null ? List.of() : List.copyOf(ips);
    if (joins < 0) joins = 0;
  }

  /** Returns the record after one more join from {@code address}. */
  public PlayerInfo withJoin(String address) {
    String a = Objects.toString(address, "");
    List<String> nextIps = ips;
    if (!a.isEmpty() && !ips.contains(a)) {
      ArrayList<String> grown = new ArrayList<>(ips.size() + 1);
      grown.addAll(ips);
      grown.add(a);
      nextIps = grown;
    }
    return new PlayerInfo(a, nextIps, joins + 1, owner);
  }

  public PlayerInfo asOwner() {
    return owner ? this : new PlayerInfo(ip, ips, joins, true);
  }
}
