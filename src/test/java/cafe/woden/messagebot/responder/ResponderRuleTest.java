package cafe.woden.messagebot.responder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.api.Player;
import cafe.woden.messagebot.world.api.PlayerGroup;
import cafe.woden.messagebot.world.api.PlayerInfo;
import cafe.woden.messagebot.world.api.WorldLists;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResponderRuleTest {

  private static final WorldLists LISTS =
      new WorldLists(List.of("ADA"), List.of("MO"), List.of(), List.of());

  private static Player player(String name, int joins) {
    return new Player(name, new PlayerInfo("", List.of(), joins, false), LISTS);
  }

  @Test
  void defaultsApplyToEveryone() {
    ResponderRule rule =
        ResponderRule.from(new MessageBotProperties.Rule("hi", null, null, null, null, null));

    assertEquals(PlayerGroup.ALL, rule.group());
    assertEquals(PlayerGroup.NOBODY, rule.notGroup());
    assertEquals(0, rule.joinsLow());
    assertEquals(9999, rule.joinsHigh());
    assertTrue(rule.appliesTo(player("ANYONE", 0)));
  }

  @Test
  void groupAndExclusionAreBothChecked() {
    ResponderRule staffButNotAdmin =
        ResponderRule.from(
            new MessageBotProperties.Rule("hey staff", null, "staff", "admin", null, null));

    assertTrue(staffButNotAdmin.appliesTo(player("MO", 1)));
    assertFalse(staffButNotAdmin.appliesTo(player("ADA", 1)));
    assertFalse(staffButNotAdmin.appliesTo(player("RANDOM", 1)));
  }

  @Test
  void joinRangeIsInclusive() {
    ResponderRule regulars =
        new ResponderRule("welcome back", "", PlayerGroup.ALL, PlayerGroup.NOBODY, 2, 5);

    assertFalse(regulars.appliesTo(player("P", 1)));
    assertTrue(regulars.appliesTo(player("P", 2)));
    assertTrue(regulars.appliesTo(player("P", 5)));
    assertFalse(regulars.appliesTo(player("P", 6)));
  }

  @Test
  void blankMessageNeverApplies() {
    ResponderRule empty = new ResponderRule(" ", "", PlayerGroup.ALL, PlayerGroup.NOBODY, 0, 10);

    assertFalse(empty.appliesTo(player("P", 1)));
  }
}
