package cafe.woden.messagebot.world;

import cafe.woden.messagebot.config.ExecutorConfig;
import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.api.ChatEventSource;
import cafe.woden.messagebot.world.api.PlayerStorage;
import cafe.woden.messagebot.world.api.WorldApi;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link World} from the server adapters.
 *
 * <p>{@link WorldApi} and {@link ChatEventSource} are supplied by the deployment; {@link
 * PlayerStorage} defaults to the YAML store.
 */
@Configuration
public class WorldConfig {

  @Bean(destroyMethod = "close")
  public World world(
      WorldApi api,
      ChatEventSource source,
      PlayerStorage storage,
      MessageBotProperties props,
      @Qualifier(ExecutorConfig.WORLD_EVENT_EXECUTOR) ExecutorService worldEventExecutor) {
    return new World(api, source, storage, props.world(), Schedulers.from(worldEventExecutor));
  }
}
