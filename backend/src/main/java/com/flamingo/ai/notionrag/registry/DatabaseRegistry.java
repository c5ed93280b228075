package com.flamingo.ai.notionrag.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.UnknownDatabaseException;
import com.flamingo.ai.notionrag.notion.NotionIds;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Label to database URL registry persisted in the {@code databases} object of {@code
 * settings.json}. Other keys of the settings file are preserved on write.
 */
@Component
@Slf4j
public class DatabaseRegistry {

  private static final String DATABASES_KEY = "databases";

  private final Path settingsPath;
  private final ObjectMapper objectMapper;
  private final Map<String, String> databases = new TreeMap<>();

  public DatabaseRegistry(NotionRagConfig config, ObjectMapper objectMapper) {
    this.settingsPath = Paths.get(config.getRegistry().getPath());
    this.objectMapper = objectMapper;
    load();
  }

  /** All registered databases ordered by label. */
  public synchronized List<DatabaseEntry> list() {
    List<DatabaseEntry> entries = new ArrayList<>();
    databases.forEach((label, url) -> entries.add(toEntry(label, url)));
    return entries;
  }

  public synchronized Optional<DatabaseEntry> find(String label) {
    String url = databases.get(label);
    return url == null ? Optional.empty() : Optional.of(toEntry(label, url));
  }

  /**
   * Resolves a label to its database. With no label, the only registered database is selected.
   *
   * @param label registered label, or {@code null}/blank to auto-select
   * @throws UnknownDatabaseException if the label is unknown or no single database can be chosen
   */
  public synchronized DatabaseEntry resolve(String label) {
    if (label != null && !label.isBlank()) {
      String url = databases.get(label);
      if (url == null) {
        throw new UnknownDatabaseException(
            label,
            "Unknown database label '" + label + "'. Available labels: " + availableLabels());
      }
      return toEntry(label, url);
    }
    if (databases.size() == 1) {
      Map.Entry<String, String> only = databases.entrySet().iterator().next();
      return toEntry(only.getKey(), only.getValue());
    }
    if (databases.isEmpty()) {
      throw new UnknownDatabaseException(
          null, "No databases registered. Initialize one with a label and database URL first.");
    }
    throw new UnknownDatabaseException(
        null, "Multiple databases registered. Specify one: " + availableLabels());
  }

  /**
   * Registers (or re-points) a label and persists the settings file.
   *
   * @throws com.flamingo.ai.notionrag.exception.InvalidIdentifierException if {@code url} holds no
   *     database id
   */
  public synchronized DatabaseEntry register(String label, String url) {
    DatabaseEntry entry = toEntry(label, url);
    databases.put(label, url);
    save();
    log.info("Registered database '{}' -> {}", label, entry.databaseId());
    return entry;
  }

  private DatabaseEntry toEntry(String label, String url) {
    return new DatabaseEntry(label, url, NotionIds.parse(url));
  }

  private String availableLabels() {
    return databases.isEmpty() ? "(none)" : String.join(", ", databases.keySet());
  }

  private void load() {
    if (!Files.exists(settingsPath)) {
      log.info("No settings file at {}; starting with an empty registry", settingsPath);
      return;
    }
    JsonNode dbs = readSettings().path(DATABASES_KEY);
    dbs.properties().forEach(e -> databases.put(e.getKey(), e.getValue().asText()));
    log.info("Loaded {} registered database(s) from {}", databases.size(), settingsPath);
  }

  private ObjectNode readSettings() {
    if (!Files.exists(settingsPath)) {
      return objectMapper.createObjectNode();
    }
    try {
      JsonNode root = objectMapper.readTree(settingsPath.toFile());
      if (root == null || !root.isObject()) {
        throw new IllegalStateException("Settings file " + settingsPath + " is not a JSON object");
      }
      return (ObjectNode) root;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read settings file " + settingsPath, e);
    }
  }

  private void save() {
    ObjectNode settings = readSettings();
    ObjectNode dbs = settings.putObject(DATABASES_KEY);
    databases.forEach(dbs::put);
    try {
      Path parent = settingsPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
      Files.writeString(settingsPath, json + "\n", StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write settings file " + settingsPath, e);
    }
  }
}
