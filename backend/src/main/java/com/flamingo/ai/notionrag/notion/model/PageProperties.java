package com.flamingo.ai.notionrag.notion.model;

import java.util.List;
import java.util.Map;

/**
 * Metadata of a Notion page.
 *
 * @param id normalized 32-character page id
 * @param lastEdited the page's {@code last_edited_time}, kept verbatim as the change fingerprint
 * @param title text of the title property, "Untitled" when empty
 * @param properties remaining readable properties by name
 */
public record PageProperties(
    String id, String lastEdited, String title, Map<String, PropertyValue> properties) {

  public static final String UNTITLED = "Untitled";

  public PageProperties {
    lastEdited = lastEdited == null ? "" : lastEdited;
    title = title == null || title.isBlank() ? UNTITLED : title;
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  /** Text of a property, or an empty string when absent. */
  public String text(String name) {
    PropertyValue value = properties.get(name);
    return value == null ? "" : value.text();
  }

  /** Option names of a multi-select property, or an empty list when absent. */
  public List<String> values(String name) {
    PropertyValue value = properties.get(name);
    return value == null ? List.of() : value.values();
  }
}
