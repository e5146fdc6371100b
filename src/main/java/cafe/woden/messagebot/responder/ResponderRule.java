package cafe.woden.messagebot.responder;

import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.api.Player;
import cafe.woden.messagebot.world.api.PlayerGroup;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A canned reply and the conditions under which it is sent.
 *
 * <p>Applies to players in {@code group}, not in {@code notGroup}, who have joined between {@code
 * joinsLow} and {@code joinsHigh} times inclusive. Trigger rules also need their trigger to match
 * the chat line.
 */
@ValueObject
public record ResponderRule(
    String message,
    String trigger,
    PlayerGroup group,
    PlayerGroup notGroup,
    int joinsLow,
    int joinsHigh) {

  public ResponderRule {
    message = Objects.toString(message, "");
    trigger = Objects.toString(trigger, "");
    if (group == null) group = PlayerGroup.ALL;
    if (notGroup == null) notGroup = PlayerGroup.NOBODY;
    if (joinsLow < 0) joinsLow = 0;
    if (joinsHigh < joinsLow) joinsHigh = joinsLow;
  }

  public static ResponderRule from(MessageBotProperties.Rule rule) {
    Objects.requireNonNull(rule, "rule");
    return new ResponderRule(
        rule.message(),
        rule.trigger(),
        PlayerGroup.parse(rule.group(), PlayerGroup.ALL),
        PlayerGroup.parse(rule.notGroup(), PlayerGroup.NOBODY),
        rule.joinsLow(),
        rule.joinsHigh());
  }

  public boolean appliesTo(Player player) {
    if (player == null || message.isBlank()) return false;
    int joins = player.getJoins();
    return player.isIn(group)
        && !player.isIn(notGroup)
        && joins >= joinsLow
        && joins <= joinsHigh;
  }

  public String render(Player player) {
    return MessageTemplate.render(message, player);
  }
}
