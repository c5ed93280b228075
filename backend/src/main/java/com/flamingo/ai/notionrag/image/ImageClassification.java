package com.flamingo.ai.notionrag.image;

import java.util.Locale;

/** What an analyzed image shows. {@link #ERROR} marks an image that could not be analyzed. */
public enum ImageClassification {
  TERMINAL,
  DIAGRAM,
  OTHER,
  ERROR;

  /**
   * Reads the value of a {@code TYPE:} line. Matching is case-insensitive and by containment;
   * anything ambiguous is {@link #OTHER}.
   */
  public static ImageClassification fromReply(String value) {
    String normalized = value == null ? "" : value.toLowerCase(Locale.ROOT);
    if (normalized.contains("terminal")) {
      return TERMINAL;
    }
    if (normalized.contains("diagram")) {
      return DIAGRAM;
    }
    return OTHER;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
