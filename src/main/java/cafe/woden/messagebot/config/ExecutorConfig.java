package cafe.woden.messagebot.config;

import cafe.woden.messagebot.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Each workload gets its own single thread so ordering is preserved and one slow consumer
 * cannot hold up another.
 */
@Configuration
public class ExecutorConfig {
  public static final String WORLD_EVENT_EXECUTOR = "worldEventExecutor";
  public static final String PLAYER_STORAGE_EXECUTOR = "playerStorageExecutor";
  public static final String ANNOUNCEMENT_SCHEDULER = "announcementScheduler";

  /** Runs chat event handling for the world, strictly one event at a time. */
  @Bean(name = WORLD_EVENT_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService worldEventExecutor() {
    return NamedThreads.newSingleThreadExecutor("messagebot-world-events");
  }

  @Bean(name = PLAYER_STORAGE_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService playerStorageExecutor() {
    return NamedThreads.newSingleThreadExecutor("messagebot-player-storage");
  }

  @Bean(name = ANNOUNCEMENT_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService announcementScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("messagebot-announcements");
  }
}
