package cafe.woden.messagebot.world.api;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Remote control API for a single game world.
 *
 * <p>Every operation is asynchronous and may fail, except the lifecycle signals which must
 * complete normally even if the server could not be reached.
 */
@ApplicationLayer
public interface WorldApi {

  Single<WorldOverview> getOverview();

  Single<WorldLists> getLists();

  Single<List<LogEntry>> getLogs();

  /** Replaces all four lists on the server. */
  Completable setLists(WorldLists lists);

  Completable send(String message);

  /** Starts the world if it is not already running. Never errors. */
  Completable start();

  /** Stops the world if it is running. Never errors. */
  Completable stop();

  /** Requests a restart; does nothing if the world is offline. Never errors. */
  Completable restart();
}
