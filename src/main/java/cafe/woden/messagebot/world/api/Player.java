package cafe.woden.messagebot.world.api;

import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a player: their history combined with the list membership known when the
 * view was built.
 *
 * <p>Views are cheap and never cached. Ask the world for a fresh one to see later list changes.
 */
public final class Player {

  private final String name;
  private final PlayerInfo info;
  private final WorldLists lists;

  public Player(String name, PlayerInfo info, WorldLists lists) {
    this.name = Objects.toString(name, "");
    this.info = info == null ? PlayerInfo.EMPTY : info;
    this.lists = lists == null ? WorldLists.empty() : lists;
  }

  /** Canonical (upper-case) name. */
  public String getName() {
    return name;
  }

  /** Most recent address, or an empty string if the player has never been seen joining. */
  public String getIp() {
    return info.ip();
  }

  public List<String> getIps() {
    return info.ips();
  }

  public int getJoins() {
    return info.joins();
  }

  public boolean hasJoined() {
    return info.joins() > 0;
  }

  public boolean isOwner() {
    return info.owner();
  }

  /** The owner is always treated as an admin. */
  public boolean isAdmin() {
    return isOwner() || lists.isAdmin(name);
  }

  /** True for players on the mod list who are not also admins. */
  public boolean isMod() {
    return !isAdmin() && lists.isMod(name);
  }

  public boolean isStaff() {
    return isAdmin() || isMod();
  }

  public boolean isWhitelisted() {
    return lists.isWhitelisted(name);
  }

  public boolean isBanned() {
    return lists.isBlacklisted(name);
  }

  public boolean isIn(PlayerGroup group) {
    if (group == null) return false;
    return switch (group) {
      case ALL -> true;
      case NOBODY -> false;
      case STAFF -> isStaff();
      case MOD -> isMod();
      case ADMIN -> isAdmin();
      case OWNER -> isOwner();
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Player other)) return false;
    return name.equals(other.name) && info.equals(other.info);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, info);
  }

  @Override
  public String toString() {
    return "Player[" + name + ", joins=" + info.joins() + (info.owner() ? ", owner" : "") + "]";
  }
}
