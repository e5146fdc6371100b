package cafe.woden.messagebot.architecture;

import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.messagebot.responder.AnnouncementService;
import cafe.woden.messagebot.responder.ChatResponderService;
import cafe.woden.messagebot.responder.ResponderRule;
import cafe.woden.messagebot.storage.PlayerHistoryAutosave;
import cafe.woden.messagebot.storage.YamlPlayerStorage;
import cafe.woden.messagebot.world.CommandRegistry;
import cafe.woden.messagebot.world.PlayerRegistry;
import cafe.woden.messagebot.world.World;
import cafe.woden.messagebot.world.api.ChatEventSource;
import cafe.woden.messagebot.world.api.LogEntry;
import cafe.woden.messagebot.world.api.PlayerInfo;
import cafe.woden.messagebot.world.api.PlayerStorage;
import cafe.woden.messagebot.world.api.WorldApi;
import cafe.woden.messagebot.world.api.WorldLists;
import cafe.woden.messagebot.world.api.WorldListsUpdate;
import cafe.woden.messagebot.world.api.WorldOverview;
import java.lang.annotation.Annotation;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.jmolecules.ddd.annotation.ValueObject;
import org.junit.jupiter.api.Test;

class JmoleculesIncrementalAdoptionTest {

  @Test
  void layeredMarkersArePresentOnBoundaryTypes() {
    assertAnnotated(WorldApi.class, ApplicationLayer.class);
    assertAnnotated(ChatEventSource.class, ApplicationLayer.class);
    assertAnnotated(PlayerStorage.class, ApplicationLayer.class);
    assertAnnotated(World.class, ApplicationLayer.class);
    assertAnnotated(PlayerRegistry.class, ApplicationLayer.class);
    assertAnnotated(CommandRegistry.class, ApplicationLayer.class);
    assertAnnotated(PlayerHistoryAutosave.class, ApplicationLayer.class);
    assertAnnotated(ChatResponderService.class, ApplicationLayer.class);
    assertAnnotated(AnnouncementService.class, ApplicationLayer.class);

    assertAnnotated(YamlPlayerStorage.class, InfrastructureLayer.class);

    assertTrue(WorldApi.class.isInterface(), "WorldApi should remain an interface");
    assertTrue(ChatEventSource.class.isInterface(), "ChatEventSource should remain an interface");
    assertTrue(PlayerStorage.class.isInterface(), "PlayerStorage should remain an interface");
  }

  @Test
  void valueObjectMarkersArePresentOnSharedDataTypes() {
    assertAnnotated(PlayerInfo.class, ValueObject.class);
    assertAnnotated(WorldOverview.class, ValueObject.class);
    assertAnnotated(WorldLists.class, ValueObject.class);
    assertAnnotated(WorldListsUpdate.class, ValueObject.class);
    assertAnnotated(LogEntry.class, ValueObject.class);
    assertAnnotated(ResponderRule.class, ValueObject.class);
  }

  private static void assertAnnotated(Class<?> type, Class<? extends Annotation> annotation) {
    assertTrue(
        type.isAnnotationPresent(annotation),
        () -> type.getSimpleName() + " should be annotated with @" + annotation.getSimpleName());
  }
}
