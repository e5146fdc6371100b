package cafe.woden.messagebot.world.api;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** One line of the world log. {@code raw} is the line as the server returned it. */
@ValueObject
public record LogEntry(Instant timestamp, String raw, String message) {
  public LogEntry {
    Objects.requireNonNull(timestamp, "timestamp");
    raw = Objects.toString(raw, "");
    message = Objects.toString(message, "");
  }
}
