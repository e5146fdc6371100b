package cafe.woden.messagebot.util;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * Stops whatever {@link NamedThreads} executors are still running when the context closes.
 *
 * <p>The world event, player storage and announcement executors are normally shut down by their
 * own bean destroy methods. Anything still alive at this point (an executor created outside a
 * bean, or one whose destroy method did not run) is stopped with {@code shutdownNow()} so queued
 * work does not run on after the context is gone.
 */
@Component
@Lazy(false)
final class NamedThreadsLifecycle {
  private static final Logger log = LoggerFactory.getLogger(NamedThreadsLifecycle.class);

  @PreDestroy
  void shutdown() {
    int stopped = NamedThreads.shutdownTrackedExecutorsNow();
    if (stopped > 0) {
      log.info("[messagebot] stopped {} leftover executor(s)", stopped);
    }
  }
}
