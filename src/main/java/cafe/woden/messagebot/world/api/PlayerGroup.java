package cafe.woden.messagebot.world.api;

import java.util.Locale;
import java.util.Objects;

/** Coarse permission groups used to filter who a rule applies to. */
public enum PlayerGroup {
  ALL,
  STAFF,
  MOD,
  ADMIN,
  OWNER,
  NOBODY;

  /** Case-insensitive lookup; blank or unknown names give {@code fallback}. */
  public static PlayerGroup parse(String name, PlayerGroup fallback) {
    String s = Objects.toString(name, "").trim();
    if (s.isEmpty()) return fallback;
    try {
      return valueOf(s.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return fallback;
    }
  }
}
