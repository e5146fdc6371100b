package cafe.woden.messagebot.world;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.messagebot.config.ExecutorConfig;
import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.responder.AnnouncementService;
import cafe.woden.messagebot.responder.ChatResponderService;
import cafe.woden.messagebot.storage.PlayerHistoryAutosave;
import cafe.woden.messagebot.storage.YamlPlayerStorage;
import cafe.woden.messagebot.world.api.ChatEventSource;
import cafe.woden.messagebot.world.api.PlayerStorage;
import cafe.woden.messagebot.world.api.WorldApi;
import io.reactivex.rxjava3.core.Completable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class WorldConfigTest {

  @TempDir Path tempDir;

  private static final WorldApi API = mock(WorldApi.class);
  private static final FakeChatEventSource SOURCE = new FakeChatEventSource();

  private ApplicationContextRunner runner() {
    return new ApplicationContextRunner()
        .withUserConfiguration(
            AdaptersTestConfig.class,
            ExecutorConfig.class,
            WorldConfig.class,
            YamlPlayerStorage.class,
            PlayerHistoryAutosave.class,
            ChatResponderService.class,
            AnnouncementService.class)
        .withPropertyValues(
            "messagebot.world.load-on-start=false",
            "messagebot.storage.file=" + tempDir.resolve("players.yml"),
            "messagebot.storage.autosave-delay-ms=10",
            "messagebot.responder.join[0].message=Hello {{Name}}");
  }

  @Test
  void wiresWorldWithYamlStorageAndResponders() {
    when(API.send(anyString())).thenReturn(Completable.complete());

    runner()
        .run(
            ctx -> {
              assertEquals(1, ctx.getBeansOfType(World.class).size());
              assertInstanceOf(YamlPlayerStorage.class, ctx.getBean(PlayerStorage.class));

              SOURCE.join("zoe", "1.2.3.4");

              verify(API, timeout(5_000)).send("Hello Zoe");
              World world = ctx.getBean(World.class);
              assertEquals(1, world.getPlayer("zoe").getJoins());
            });
  }

  @Test
  void contextCloseFlushesPlayerHistoryToDisk() {
    when(API.send(anyString())).thenReturn(Completable.complete());

    runner()
        .withPropertyValues("messagebot.storage.autosave-delay-ms=600000")
        .run(
            ctx -> {
              SOURCE.join("yan", "5.6.7.8");
              verify(API, timeout(5_000)).send("Hello Yan");
            });

    Path file = tempDir.resolve("players.yml");
    assertTrue(Files.exists(file));
    assertTrue(new YamlPlayerStorage(file).load("mb_players", Map.of()).containsKey("YAN"));
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(MessageBotProperties.class)
  static class AdaptersTestConfig {
    @Bean
    WorldApi worldApi() {
      return API;
    }

    @Bean
    ChatEventSource chatEventSource() {
      return SOURCE;
    }
  }
}
