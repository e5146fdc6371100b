package cafe.woden.messagebot.storage;

import cafe.woden.messagebot.config.ExecutorConfig;
import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.World;
import cafe.woden.messagebot.world.api.PlayerStorage;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Writes the player registry back to storage after it changes.
 *
 * <p>Changes are debounced so a burst of joins produces one write. Any pending change is flushed on
 * shutdown.
 */
@Component
@ApplicationLayer
public class PlayerHistoryAutosave {
  private static final Logger log = LoggerFactory.getLogger(PlayerHistoryAutosave.class);

  private final World world;
  private final PlayerStorage storage;
  private final MessageBotProperties props;
  private final Scheduler scheduler;

  private final CompositeDisposable disposables = new CompositeDisposable();
  private final AtomicBoolean dirty = new AtomicBoolean(false);

  @Autowired
  public PlayerHistoryAutosave(
      World world,
      PlayerStorage storage,
      MessageBotProperties props,
      @Qualifier(ExecutorConfig.PLAYER_STORAGE_EXECUTOR) ExecutorService storageExec) {
    this(world, storage, props, Schedulers.from(Objects.requireNonNull(storageExec, "storageExec")));
  }

  PlayerHistoryAutosave(
      World world, PlayerStorage storage, MessageBotProperties props, Scheduler scheduler) {
    this.world = Objects.requireNonNull(world, "world");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.props = Objects.requireNonNull(props, "props");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @PostConstruct
  void start() {
    if (!props.storage().autosave()) {
      log.info("[messagebot] player autosave disabled");
      return;
    }
    disposables.add(
        world
            .playerChanges()
            .doOnNext(name -> dirty.set(true))
            .debounce(props.storage().autosaveDelayMs(), TimeUnit.MILLISECONDS, scheduler)
            .subscribe(
                name -> saveNow(),
                err -> log.error("[messagebot] player autosave stopped", err)));
  }

  /** Saves immediately if anything changed since the last save. */
  public void flush() {
    if (dirty.get()) saveNow();
  }

  boolean isDirty() {
    return dirty.get();
  }

  private void saveNow() {
    dirty.set(false);
    try {
      storage.save(props.world().playersKey(), world.playerSnapshot());
      log.debug("[messagebot] player history saved");
    } catch (RuntimeException e) {
      dirty.set(true);
      log.warn("[messagebot] player history save failed", e);
    }
  }

  @PreDestroy
  void shutdown() {
    disposables.dispose();
    flush();
  }
}
