package com.flamingo.ai.notionrag.notion.model;

import java.util.List;

/** Value of a named page property, reduced to text or a list of option names. */
public record PropertyValue(PropertyType type, String text, List<String> values) {

  /** Property types the service reads from a page. */
  public enum PropertyType {
    TITLE,
    RICH_TEXT,
    SELECT,
    MULTI_SELECT,
    URL
  }

  public PropertyValue {
    text = text == null ? "" : text;
    values = values == null ? List.of() : List.copyOf(values);
  }

  public static PropertyValue text(PropertyType type, String text) {
    return new PropertyValue(type, text, List.of());
  }

  public static PropertyValue multiSelect(List<String> values) {
    return new PropertyValue(PropertyType.MULTI_SELECT, String.join(", ", values), values);
  }
}
