package cafe.woden.messagebot.world.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * The four player lists a world keeps.
 *
 * <p>Lists are not required to be disjoint. Each instance owns its lists; {@link #copy()} hands out
 * independent ones.
 */
@ValueObject
public record WorldLists(
    List<String> adminlist, List<String> modlist, List<String> whitelist, List<String> blacklist) {

  public static WorldLists empty() {
    return new WorldLists(List.of(), List.of(), List.of(), List.of());
  }

  public WorldLists {
    adminlist = own(adminlist);
    modlist = own(modlist);
    whitelist = own(whitelist);
    blacklist = own(blacklist);
  }

  public WorldLists copy() {
    return new WorldLists(adminlist, modlist, whitelist, blacklist);
  }

  /** Applies a partial update; lists the update leaves out are kept as they are. */
  public WorldLists merge(WorldListsUpdate update) {
    if (update == null) return copy();
    return new WorldLists(
        update.adminlist() != null ? update.adminlist() : adminlist,
        update.modlist() != null ? update.modlist() : modlist,
        update.whitelist() != null ? update.whitelist() : whitelist,
        update.blacklist() != null ? update.blacklist() : blacklist);
  }

  public boolean isAdmin(String name) {
    return containsIgnoreCase(adminlist, name);
  }

  public boolean isMod(String name) {
    return containsIgnoreCase(modlist, name);
  }

  public boolean isWhitelisted(String name) {
    return containsIgnoreCase(whitelist, name);
  }

  public boolean isBlacklisted(String name) {
    return containsIgnoreCase(blacklist, name);
  }

  private static boolean containsIgnoreCase(List<String> list, String name) {
    String needle = Objects.toString(name, "").trim().toUpperCase(Locale.ROOT);
    if (needle.isEmpty()) return false;
    for (String entry : list) {
      if (entry != null && needle.equals(entry.trim().toUpperCase(Locale.ROOT))) return true;
    }
    return false;
  }

  private static List<String> own(List<String> list) {
    return list == null ? new ArrayList<>() : new ArrayList<>(list);
  }
}
