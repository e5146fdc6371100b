package cafe.woden.messagebot.world.api;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/** Partial list update. A {@code null} list is left unchanged on the server. */
@ValueObject
public record WorldListsUpdate(
    List<String> adminlist, List<String> modlist, List<String> whitelist, List<String> blacklist) {

  public WorldListsUpdate {
    adminlist = adminlist == null ? null : List.copyOf(adminlist);
    modlist = modlist == null ? null : List.copyOf(modlist);
    whitelist = whitelist == null ? null : List.copyOf(whitelist);
    blacklist = blacklist == null ? null : List.copyOf(blacklist);
  }

  public static WorldListsUpdate adminlist(List<String> names) {
    return new WorldListsUpdate(names, null, null, null);
  }

  public static WorldListsUpdate modlist(List<String> names) {
    return new WorldListsUpdate(null, names, null, null);
  }

  public static WorldListsUpdate whitelist(List<String> names) {
    return new WorldListsUpdate(null, null, names, null);
  }

  public static WorldListsUpdate blacklist(List<String> names) {
    return new WorldListsUpdate(null, null, null, names);
  }
}
