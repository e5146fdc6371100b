package cafe.woden.messagebot.responder;

import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.World;
import cafe.woden.messagebot.world.api.Player;
import cafe.woden.messagebot.world.api.PlayerMessage;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends configured replies when players join, leave or say a trigger phrase.
 *
 * <p>Every matching rule fires, in configured order.
 */
@Component
@ApplicationLayer
public class ChatResponderService {
  private static final Logger log = LoggerFactory.getLogger(ChatResponderService.class);

  private final World world;
  private final boolean enabled;
  private final List<ResponderRule> joinRules;
  private final List<ResponderRule> leaveRules;
  private final List<TriggerRule> triggerRules;

  private final CompositeDisposable disposables = new CompositeDisposable();

  private record TriggerRule(ResponderRule rule, TriggerMatcher matcher) {}

  public ChatResponderService(World world, MessageBotProperties props) {
    this.world = Objects.requireNonNull(world, "world");
    MessageBotProperties.Responder cfg = Objects.requireNonNull(props, "props").responder();
    this.enabled = cfg.enabled();
    this.joinRules = cfg.join().stream().map(ResponderRule::from).toList();
    this.leaveRules = cfg.leave().stream().map(ResponderRule::from).toList();

    List<TriggerRule> triggers = new ArrayList<>();
    for (MessageBotProperties.Rule r : cfg.trigger()) {
      ResponderRule rule = ResponderRule.from(r);
      triggers.add(new TriggerRule(rule, TriggerMatcher.compile(rule.trigger(), cfg.regexTriggers())));
    }
    this.triggerRules = List.copyOf(triggers);
  }

  @PostConstruct
  void start() {
    if (!enabled) {
      log.info("[messagebot] chat responder disabled");
      return;
    }
    disposables.add(
        world
            .onJoin()
            .subscribe(this::onJoin, err -> log.error("[messagebot] join responder stopped", err)));
    disposables.add(
        world
            .onLeave()
            .subscribe(
                this::onLeave, err -> log.error("[messagebot] leave responder stopped", err)));
    disposables.add(
        world
            .onMessage()
            .subscribe(
                this::onMessage, err -> log.error("[messagebot] trigger responder stopped", err)));
    log.info(
        "[messagebot] chat responder started: {} join, {} leave, {} trigger rules",
        joinRules.size(),
        leaveRules.size(),
        triggerRules.size());
  }

  void onJoin(Player player) {
    for (ResponderRule rule : joinRules) {
      if (rule.appliesTo(player)) send(rule.render(player));
    }
  }

  void onLeave(Player player) {
    for (ResponderRule rule : leaveRules) {
      if (rule.appliesTo(player)) send(rule.render(player));
    }
  }

  void onMessage(PlayerMessage message) {
    Player player = message.player();
    for (TriggerRule t : triggerRules) {
      if (t.matcher().matches(message.message()) && t.rule().appliesTo(player)) {
        send(t.rule().render(player));
      }
    }
  }

  private void send(String text) {
    if (text == null || text.isBlank()) return;
    // The container drops each send once it terminates.
    world
        .send(text)
        .subscribe(
            () -> log.debug("[messagebot] sent: {}", text),
            err -> log.warn("[messagebot] could not send: {}", text, err),
            disposables);
  }

  int activeSubscriptions() {
    return disposables.size();
  }

  @PreDestroy
  void shutdown() {
    disposables.dispose();
  }
}
