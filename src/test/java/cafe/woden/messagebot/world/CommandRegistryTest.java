package cafe.woden.messagebot.world;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.messagebot.world.api.DuplicateCommandException;
import cafe.woden.messagebot.world.api.Player;
import cafe.woden.messagebot.world.api.PlayerInfo;
import cafe.woden.messagebot.world.api.WorldLists;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommandRegistryTest {

  private final Player admin = new Player("ADMIN", PlayerInfo.EMPTY, WorldLists.empty());

  @Test
  void dispatchesByCaseInsensitiveTokenWithArguments() {
    CommandRegistry registry = new CommandRegistry();
    List<String> calls = new ArrayList<>();
    registry.register("kick", (player, args) -> calls.add(player.getName() + ":" + args));

    assertTrue(registry.dispatch("/KICK griefer now", admin));
    assertTrue(registry.dispatch("/Kick", admin));

    assertEquals(List.of("ADMIN:griefer now", "ADMIN:"), calls);
  }

  @Test
  void unknownOrMalformedCommandsAreIgnored() {
    CommandRegistry registry = new CommandRegistry();
    List<String> calls = new ArrayList<>();
    registry.register("kick", (player, args) -> calls.add(args));

    assertFalse(registry.dispatch("/unknown x", admin));
    assertFalse(registry.dispatch("/ kick", admin));
    assertFalse(registry.dispatch("kick griefer", admin));
    assertFalse(registry.dispatch("/", admin));
    assertFalse(registry.dispatch(null, admin));
    assertTrue(calls.isEmpty());
  }

  @Test
  void argumentsDoNotSpanLines() {
    CommandRegistry registry = new CommandRegistry();
    List<String> calls = new ArrayList<>();
    registry.register("kick", (player, args) -> calls.add(args));

    assertFalse(registry.looksLikeCommand("/kick griefer\nand everyone else"));
    assertFalse(registry.dispatch("/kick griefer\nand everyone else", admin));
    assertTrue(calls.isEmpty());

    assertTrue(registry.dispatch("/kick griefer", admin));
    assertEquals(List.of("griefer"), calls);
  }

  @Test
  void duplicateRegistrationIsRejectedRegardlessOfCase() {
    CommandRegistry registry = new CommandRegistry();
    registry.register("ban", (player, args) -> {});

    DuplicateCommandException ex =
        assertThrows(DuplicateCommandException.class, () -> registry.register("BAN", (p, a) -> {}));
    assertEquals("BAN", ex.command());
  }

  @Test
  void blankTokenIsRejected() {
    CommandRegistry registry = new CommandRegistry();

    assertThrows(IllegalArgumentException.class, () -> registry.register("  ", (p, a) -> {}));
  }

  @Test
  void unregisterFreesTheTokenForReuse() {
    CommandRegistry registry = new CommandRegistry();
    List<String> calls = new ArrayList<>();
    registry.register("warp", (p, a) -> calls.add("old"));

    registry.unregister("WARP");
    assertFalse(registry.dispatch("/warp", admin));
    registry.register("warp", (p, a) -> calls.add("new"));
    registry.dispatch("/warp", admin);

    assertEquals(List.of("new"), calls);
  }

  @Test
  void failingHandlerIsContained() {
    CommandRegistry registry = new CommandRegistry();
    registry.register(
        "boom",
        (p, a) -> {
          throw new IllegalStateException("handler failed");
        });

    assertTrue(registry.dispatch("/boom", admin));
  }

  @Test
  void customPrefixIsHonoured() {
    CommandRegistry registry = new CommandRegistry('!');
    List<String> calls = new ArrayList<>();
    registry.register("help", (p, a) -> calls.add(a));

    assertFalse(registry.dispatch("/help", admin));
    assertTrue(registry.looksLikeCommand("!help me"));
    assertTrue(registry.dispatch("!help me", admin));
    assertEquals(List.of("me"), calls);
  }
}
