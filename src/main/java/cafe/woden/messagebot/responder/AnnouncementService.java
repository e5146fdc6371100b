package cafe.woden.messagebot.responder;

import cafe.woden.messagebot.config.ExecutorConfig;
import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.World;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Rotating announcements.
 *
 * <p>One announcement is sent every {@code announcementDelayMinutes}; the first goes out after one
 * full delay. After the last one the rotation starts over.
 */
@Component
@ApplicationLayer
public class AnnouncementService {
  private static final Logger log = LoggerFactory.getLogger(AnnouncementService.class);

  private final World world;
  private final List<String> announcements;
  private final boolean enabled;
  private final long delayMinutes;
  private final Scheduler scheduler;

  private final AtomicInteger next = new AtomicInteger(0);
  private final CompositeDisposable disposables = new CompositeDisposable();

  @Autowired
  public AnnouncementService(
      World world,
      MessageBotProperties props,
      @Qualifier(ExecutorConfig.ANNOUNCEMENT_SCHEDULER) ScheduledExecutorService announcementExec) {
    this(world, props, Schedulers.from(Objects.requireNonNull(announcementExec, "announcementExec")));
  }

  AnnouncementService(World world, MessageBotProperties props, Scheduler scheduler) {
    this.world = Objects.requireNonNull(world, "world");
    MessageBotProperties.Responder cfg = Objects.requireNonNull(props, "props").responder();
    this.announcements = cfg.announcements();
    this.enabled = cfg.enabled();
    this.delayMinutes = cfg.announcementDelayMinutes();
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @PostConstruct
  void start() {
    if (!enabled || announcements.isEmpty()) return;
    disposables.add(
        Flowable.interval(delayMinutes, delayMinutes, TimeUnit.MINUTES, scheduler)
            .onBackpressureDrop()
            .subscribe(
                tick -> announceNext(),
                err -> log.error("[messagebot] announcements stopped", err)));
    log.info(
        "[messagebot] {} announcements every {} minutes", announcements.size(), delayMinutes);
  }

  void announceNext() {
    int i = Math.floorMod(next.getAndIncrement(), announcements.size());
    String text = announcements.get(i);
    world
        .send(text)
        .subscribe(
            () -> log.debug("[messagebot] announced #{}", i),
            err -> log.warn("[messagebot] announcement #{} failed", i, err),
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
