package cafe.woden.messagebot.util;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors on named daemon threads. */
public final class NamedThreads {
  private static final Set<ExecutorService> TRACKED_EXECUTORS = ConcurrentHashMap.newKeySet();

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger counter = new AtomicInteger(1);
    return task -> {
      Thread t = new Thread(task, base + "-" + counter.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newSingleThreadExecutor(String baseName) {
    return track(Executors.newSingleThreadExecutor(namedFactory(baseName)));
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return track(Executors.newSingleThreadScheduledExecutor(namedFactory(baseName)));
  }

  public static int shutdownTrackedExecutorsNow() {
    int count = 0;
    for (ExecutorService exec : List.copyOf(TRACKED_EXECUTORS)) {
      if (exec == null) continue;
      if (exec.isShutdown() || exec.isTerminated()) continue;
      exec.shutdownNow();
      count++;
    }
    TRACKED_EXECUTORS.clear();
    return count;
  }

  private static <E extends ExecutorService> E track(E exec) {
    pruneTrackedExecutors();
    TRACKED_EXECUTORS.add(exec);
    return exec;
  }

  private static void pruneTrackedExecutors() {
    TRACKED_EXECUTORS.removeIf(exec -> exec == null || exec.isShutdown() || exec.isTerminated());
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "messagebot-thread" : s;
  }
}
