package cafe.woden.messagebot.world;

import cafe.woden.messagebot.world.api.RemoteFetchException;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.functions.Consumer;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoized view of one remote resource with single-flight refresh.
 *
 * <p>At most one fetch is outstanding at a time and every caller that arrives while it runs shares
 * its outcome. A fetch is started eagerly and always runs to completion, so a caller that stops
 * waiting does not cancel it for the others. Failures are not retried: the slot keeps the last good
 * value (if any) and only an explicit refresh fetches again.
 *
 * <p>The lock guards only this slot's bookkeeping; the fetch itself is started after it is released.
 */
final class CachedResource<T> {
  private static final Logger log = LoggerFactory.getLogger(CachedResource.class);

  enum State {
    EMPTY,
    PENDING,
    READY,
    FAILED
  }

  private final String name;
  private final Supplier<Single<T>> fetcher;
  private final Consumer<T> onFetched;
  private final UnaryOperator<T> copier;

  private final Object lock = new Object();
  private State state = State.EMPTY;
  private T value;
  private Throwable failure;
  private Single<T> pending;
  private long generation;
  private long fetchCount;

  /**
   * @param fetcher starts one remote fetch each time it is called
   * @param onFetched runs once per successful fetch, before any caller sees the value
   * @param copier produces the independent copy handed to each caller
   */
  CachedResource(
      String name, Supplier<Single<T>> fetcher, Consumer<T> onFetched, UnaryOperator<T> copier) {
    this.name = Objects.requireNonNull(name, "name");
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.onFetched = onFetched == null ? v -> {} : onFetched;
    this.copier = Objects.requireNonNull(copier, "copier");
  }

  Single<T> get(boolean refresh) {
    Single<T> source;
    Single<T> started = null;
    synchronized (lock) {
      if (pending != null) {
        source = pending;
      } else if (refresh || state == State.EMPTY) {
        started = startFetchLocked();
        source = started;
      } else if (value != null) {
        source = Single.just(value);
      } else {
        source = Single.error(failure);
      }
    }
    if (started != null) launch(started);
    return source.map(copier::apply);
  }

  /**
   * Fetches a value that reflects every write completed before this call.
   *
   * <p>A fetch already in flight may have been answered before such a write, so it is awaited
   * (its outcome ignored) and a fetch started after it settles is returned instead.
   */
  Single<T> reload() {
    Single<T> inFlight;
    Single<T> started = null;
    synchronized (lock) {
      inFlight = pending;
      if (inFlight == null) started = startFetchLocked();
    }
    if (started != null) {
      launch(started);
      return started.map(copier::apply);
    }
    return inFlight.ignoreElement().onErrorComplete().andThen(Single.defer(() -> get(true)));
  }

  State state() {
    synchronized (lock) {
      return state;
    }
  }

  /** Number of fetches started so far. */
  long fetchCount() {
    synchronized (lock) {
      return fetchCount;
    }
  }

  // Subscribe now so the fetch completes even if every caller walks away.
  private void launch(Single<T> started) {
    started.subscribe(
        v -> log.debug("[messagebot] {} fetched", name),
        err -> log.warn("[messagebot] {} fetch failed: {}", name, err.getMessage()));
  }

  private Single<T> startFetchLocked() {
    long gen = ++generation;
    fetchCount++;
    state = State.PENDING;
    log.debug("[messagebot] fetching {} (#{})", name, gen);

    Single<T> fetch =
        Single.defer(fetcher::get)
            .onErrorResumeNext(
                err ->
                    Single.error(
                        err instanceof RemoteFetchException ? err : new RemoteFetchException(name, err)))
            .doOnSuccess(onFetched)
            .doOnSuccess(v -> settle(gen, v, null))
            .doOnError(err -> settle(gen, null, err))
            .cache();
    pending = fetch;
    return fetch;
  }

  private void settle(long gen, T fetched, Throwable err) {
    synchronized (lock) {
      if (gen != generation) return;
      pending = null;
      if (err == null) {
        value = fetched;
        failure = null;
        state = State.READY;
      } else {
        failure = err;
        state = State.FAILED;
      }
    }
  }
}
