package cafe.woden.messagebot.world;

import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.api.ChatEvent;
import cafe.woden.messagebot.world.api.ChatEventSource;
import cafe.woden.messagebot.world.api.CommandHandler;
import cafe.woden.messagebot.world.api.LogEntry;
import cafe.woden.messagebot.world.api.OnlinePlayers;
import cafe.woden.messagebot.world.api.Player;
import cafe.woden.messagebot.world.api.PlayerInfo;
import cafe.woden.messagebot.world.api.PlayerMessage;
import cafe.woden.messagebot.world.api.PlayerStorage;
import cafe.woden.messagebot.world.api.WorldApi;
import cafe.woden.messagebot.world.api.WorldLists;
import cafe.woden.messagebot.world.api.WorldListsUpdate;
import cafe.woden.messagebot.world.api.WorldOverview;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live model of one game world.
 *
 * <p>Consumes raw chat events, keeps player history up to date and republishes each event with a
 * resolved {@link Player}. Chat lines that look like commands are handed to the command registry.
 * Events are handled one at a time, in arrival order, on the event scheduler.
 *
 * <p>Overview, lists and logs are fetched lazily and cached; see {@link CachedResource} for the
 * refresh rules. Every value returned from a read is a private copy.
 */
@ApplicationLayer
public class World implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(World.class);

  private final WorldApi api;
  private final OnlinePlayers online;
  private final PlayerRegistry players;
  private final CommandRegistry commands;

  private final CachedResource<WorldOverview> overview;
  private final CachedResource<WorldLists> lists;
  private final CachedResource<List<LogEntry>> logs;

  private volatile WorldLists currentLists = WorldLists.empty();

  private final FlowableProcessor<Player> joins = PublishProcessor.<Player>create().toSerialized();
  private final FlowableProcessor<Player> leaves = PublishProcessor.<Player>create().toSerialized();
  private final FlowableProcessor<PlayerMessage> messages =
      PublishProcessor.<PlayerMessage>create().toSerialized();
  private final FlowableProcessor<String> others = PublishProcessor.<String>create().toSerialized();

  private final CompositeDisposable disposables = new CompositeDisposable();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Handles events on the thread that emits them. */
  public World(WorldApi api, ChatEventSource source, PlayerStorage storage) {
    this(api, source, storage, MessageBotProperties.World.defaults(), Schedulers.trampoline());
  }

  public World(
      WorldApi api,
      ChatEventSource source,
      PlayerStorage storage,
      MessageBotProperties.World settings,
      Scheduler eventScheduler) {
    this.api = Objects.requireNonNull(api, "api");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(storage, "storage");
    MessageBotProperties.World cfg =
        settings == null ? MessageBotProperties.World.defaults() : settings;
    Scheduler scheduler = eventScheduler == null ? Schedulers.trampoline() : eventScheduler;

    this.online = Objects.requireNonNull(source.online(), "source.online()");
    this.players = new PlayerRegistry(storage.load(cfg.playersKey(), Map.of()));
    this.commands = new CommandRegistry(cfg.commandPrefix());

    this.overview =
        new CachedResource<>("overview", api::getOverview, this::onOverviewFetched, WorldOverview::copy);
    this.lists =
        new CachedResource<>("lists", api::getLists, fetched -> currentLists = fetched, WorldLists::copy);
    this.logs = new CachedResource<>("logs", api::getLogs, null, World::copyLogs);

    disposables.add(
        source
            .events()
            .onBackpressureBuffer()
            .observeOn(scheduler)
            .subscribe(
                this::onChatEvent,
                err -> log.error("[messagebot] chat event stream terminated", err)));

    log.info("[messagebot] world started with {} known players", players.size());

    if (cfg.loadOnStart()) {
      // Seeds the owner and online players without blocking construction.
      disposables.add(
          getOverview(false)
              .subscribe(
                  o -> log.debug("[messagebot] owner is {}", o.owner()),
                  err -> log.debug("[messagebot] initial overview load failed", err)));
      disposables.add(
          getLists(false)
              .subscribe(
                  l -> log.debug("[messagebot] {} admins loaded", l.adminlist().size()),
                  err -> log.debug("[messagebot] initial lists load failed", err)));
    }
  }

  // --- events -------------------------------------------------------------------------------

  /** Fires whenever a player joins the server. */
  public Flowable<Player> onJoin() {
    return joins.onBackpressureBuffer();
  }

  /** Fires whenever a player leaves the server. */
  public Flowable<Player> onLeave() {
    return leaves.onBackpressureBuffer();
  }

  /** Fires for every chat line, including lines that start with a command. */
  public Flowable<PlayerMessage> onMessage() {
    return messages.onBackpressureBuffer();
  }

  /** Log lines the event source could not parse, passed through unchanged. */
  public Flowable<String> onOther() {
    return others.onBackpressureBuffer();
  }

  void onChatEvent(ChatEvent event) {
    if (event == null) return;
    try {
      if (event instanceof ChatEvent.Join join) {
        handleJoin(join);
      } else if (event instanceof ChatEvent.Leave leave) {
        leaves.onNext(getPlayer(leave.name()));
      } else if (event instanceof ChatEvent.Message msg) {
        handleMessage(msg);
      } else if (event instanceof ChatEvent.Other other) {
        others.onNext(other.line());
      }
    } catch (RuntimeException e) {
      log.warn("[messagebot] failed to handle {}", event, e);
    }
  }

  private void handleJoin(ChatEvent.Join join) {
    players.recordJoin(join.name(), join.ip());
    joins.onNext(getPlayer(join.name()));
  }

  private void handleMessage(ChatEvent.Message msg) {
    Player player = getPlayer(msg.name());
    messages.onNext(new PlayerMessage(player, msg.message()));
    if (commands.looksLikeCommand(msg.message())) {
      commands.dispatch(msg.message(), player);
    }
  }

  // --- state --------------------------------------------------------------------------------

  /** Names currently online, in the order they were seen. */
  public List<String> online() {
    return online.snapshot();
  }

  /** Every player who has ever joined, plus the owner once known. */
  public List<Player> players() {
    List<Player> out = new ArrayList<>();
    for (String name : players.names()) {
      out.add(getPlayer(name));
    }
    return out;
  }

  /** Never fails; players who have never joined get an empty history. */
  public Player getPlayer(String name) {
    String key = PlayerRegistry.canonicalName(name);
    return new Player(key, players.get(key), currentLists);
  }

  PlayerRegistry registry() {
    return players;
  }

  // --- cached reads -------------------------------------------------------------------------

  public Single<WorldOverview> getOverview(boolean refresh) {
    return overview.get(refresh);
  }

  public Single<WorldOverview> getOverview() {
    return getOverview(false);
  }

  public Single<WorldLists> getLists(boolean refresh) {
    return lists.get(refresh);
  }

  public Single<WorldLists> getLists() {
    return getLists(false);
  }

  public Single<List<LogEntry>> getLogs(boolean refresh) {
    return logs.get(refresh);
  }

  public Single<List<LogEntry>> getLogs() {
    return getLogs(false);
  }

  private void onOverviewFetched(WorldOverview fetched) {
    online.addAll(fetched.online());
    if (!fetched.owner().isBlank()) {
      players.markOwner(fetched.owner());
    }
  }

  private static List<LogEntry> copyLogs(List<LogEntry> entries) {
    return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
  }

  // --- writes -------------------------------------------------------------------------------

  /**
   * Updates one or more lists. Lists missing from {@code update} keep their current contents.
   *
   * <p>Completes once the server has accepted the change and the lists have been reloaded. If the
   * server rejects it the cached lists are left as they were.
   */
  public Completable setLists(WorldListsUpdate update) {
    return getLists(false)
        .flatMapCompletable(current -> api.setLists(current.merge(update)))
        .andThen(Completable.defer(() -> lists.reload().ignoreElement()));
  }

  public Completable send(String message) {
    return api.send(message);
  }

  public Completable start() {
    return api.start();
  }

  public Completable stop() {
    return api.stop();
  }

  public Completable restart() {
    return api.restart();
  }

  // --- commands -----------------------------------------------------------------------------

  /**
   * Adds a handler for a single chat command, matched case-insensitively.
   *
   * @throws cafe.woden.messagebot.world.api.DuplicateCommandException if already added
   */
  public void addCommand(String command, CommandHandler handler) {
    commands.register(command, handler);
  }

  /** Removes the handler for {@code command}, if there is one. */
  public void removeCommand(String command) {
    commands.unregister(command);
  }

  public CommandRegistry commands() {
    return commands;
  }

  /** Player history changes, for persistence. */
  public Flowable<String> playerChanges() {
    return players.changes();
  }

  public Map<String, PlayerInfo> playerSnapshot() {
    return players.snapshot();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    disposables.dispose();
    joins.onComplete();
    leaves.onComplete();
    messages.onComplete();
    others.onComplete();
  }
}
