package cafe.woden.messagebot.world.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Summary of a world as reported by the server.
 *
 * <p>{@code owner} and {@code online} drive the world state; the remaining fields are passed
 * through for callers that display them. The {@code online} list is owned by this instance, so
 * callers holding a {@link #copy()} may edit it freely.
 */
@ValueObject
public record WorldOverview(
    String name,
    String owner,
    List<String> online,
    String status,
    String privacy,
    int playerLimit) {

  public WorldOverview {
    name = Objects.toString(name, "");
    owner = Objects.toString(owner, "");
    online = online == null ? new ArrayList<>() : new ArrayList<>(online);
    status = Objects.toString(status, "");
    privacy = Objects.toString(privacy, "");
    if (playerLimit < 0) playerLimit = 0;
  }

  public WorldOverview(String owner, List<String> online) {
    this("", owner, online, "", "", 0);
  }

  public WorldOverview copy() {
    return new WorldOverview(name, owner, online, status, privacy, playerLimit);
  }
}
