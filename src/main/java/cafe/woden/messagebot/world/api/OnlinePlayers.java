package cafe.woden.messagebot.world.api;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Insertion-ordered set of online player names, safe to share between threads. */
public final class OnlinePlayers {

  private final Set<String> names = new LinkedHashSet<>();

  public synchronized boolean add(String name) {
    String n = Objects.toString(name, "").trim();
    if (n.isEmpty()) return false;
    return names.add(n);
  }

  /** Adds every name not already present, keeping the existing order. */
  public synchronized void addAll(Collection<String> toAdd) {
    if (toAdd == null) return;
    for (String name : toAdd) {
      add(name);
    }
  }

  public synchronized boolean remove(String name) {
    return names.remove(Objects.toString(name, "").trim());
  }

  public synchronized boolean contains(String name) {
    return names.contains(Objects.toString(name, "").trim());
  }

  public synchronized List<String> snapshot() {
    return List.copyOf(names);
  }

  public synchronized int size() {
    return names.size();
  }
}
