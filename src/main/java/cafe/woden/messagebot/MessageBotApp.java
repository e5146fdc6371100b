package cafe.woden.messagebot;

import cafe.woden.messagebot.config.MessageBotProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "MessageBot",
    sharedModules = {"config", "util"})
@EnableConfigurationProperties(MessageBotProperties.class)
public class MessageBotApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(MessageBotApp.class).run(args);
  }
}
