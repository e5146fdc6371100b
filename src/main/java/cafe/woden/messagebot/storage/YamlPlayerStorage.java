package cafe.woden.messagebot.storage;

import cafe.woden.messagebot.config.MessageBotProperties;
import cafe.woden.messagebot.world.api.PlayerInfo;
import cafe.woden.messagebot.world.api.PlayerStorage;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Stores player history in a YAML file, one top-level mapping per storage key.
 *
 * <pre>
 * mb_players:
 *   STEVE:
 *     ip: 10.0.0.7
 *     ips: [10.0.0.7]
 *     joins: 3
 *     owner: true
 * </pre>
 *
 * Other top-level keys in the file are preserved on save.
 */
@Component
@InfrastructureLayer
public class YamlPlayerStorage implements PlayerStorage {

  private static final Logger log = LoggerFactory.getLogger(YamlPlayerStorage.class);

  private final Path file;
  private final Yaml yaml;

  @Autowired
  public YamlPlayerStorage(MessageBotProperties props) {
    this(Paths.get(Objects.requireNonNull(props, "props").storage().file().trim()));
  }

  public YamlPlayerStorage(Path file) {
    this.file = Objects.requireNonNull(file, "file");

    DumperOptions opts = new DumperOptions();
    opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    opts.setPrettyFlow(true);
    opts.setIndent(2);
    // SnakeYAML requires indicatorIndent < indent.
    opts.setIndicatorIndent(1);
    opts.setDefaultScalarStyle(DumperOptions.ScalarStyle.PLAIN);
    this.yaml = new Yaml(opts);

    log.info("[messagebot] player storage at {}", file.toAbsolutePath());
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized Map<String, PlayerInfo> load(String key, Map<String, PlayerInfo> fallback) {
    try {
      if (!Files.exists(file)) return fallback;
      Object section = loadFile().get(key);
      if (!(section instanceof Map<?, ?> byName)) return fallback;

      Map<String, PlayerInfo> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : byName.entrySet()) {
        String name = Objects.toString(e.getKey(), "").trim();
        if (name.isEmpty()) continue;
        if (!(e.getValue() instanceof Map<?, ?> fields)) continue;
        out.put(name, toPlayerInfo(fields));
      }
      return out;
    } catch (Exception ex) {
      log.warn("[messagebot] could not read players from {}", file, ex);
      return fallback;
    }
  }

  @Override
  public synchronized void save(String key, Map<String, PlayerInfo> players) {
    try {
      Map<String, Object> doc = Files.exists(file) ? loadFile() : new LinkedHashMap<>();
      Map<String, Object> byName = new LinkedHashMap<>();
      if (players != null) {
        for (Map.Entry<String, PlayerInfo> e : players.entrySet()) {
          if (e.getKey() == null || e.getValue() == null) continue;
          byName.put(e.getKey(), toMap(e.getValue()));
        }
      }
      doc.put(key, byName);
      writeFile(doc);
    } catch (Exception ex) {
      log.warn("[messagebot] could not write players to {}", file, ex);
    }
  }

  private static PlayerInfo toPlayerInfo(Map<?, ?> fields) {
    String ip = Objects.toString(fields.get("ip"), "");
    List<String> ips = new ArrayList<>();
    if (fields.get("ips") instanceof List<?> list) {
      for (Object o : list) {
        String s = Objects.toString(o, "").trim();
        if (!s.isEmpty() && !ips.contains(s)) ips.add(s);
      }
    }
    int joins = fields.get("joins") instanceof Number n ? n.intValue() : 0;
    boolean owner = Boolean.TRUE.equals(fields.get("owner"));
    return new PlayerInfo(ip, ips, joins, owner);
  }

  private static Map<String, Object> toMap(PlayerInfo info) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("ip", info.ip());
    m.put("ips", new ArrayList<>(info.ips()));
    m.put("joins", info.joins());
    if (info.owner()) m.put("owner", true);
    return m;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> loadFile() throws IOException {
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object o = yaml.load(r);
      if (o instanceof Map<?, ?> m) {
        return new LinkedHashMap<>((Map<String, Object>) m);
      }
      return new LinkedHashMap<>();
    }
  }

  private void writeFile(Map<String, Object> doc) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
      yaml.dump(doc, w);
    }
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
