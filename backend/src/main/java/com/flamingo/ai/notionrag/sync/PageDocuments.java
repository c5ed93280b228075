package com.flamingo.ai.notionrag.sync;

import com.flamingo.ai.notionrag.notion.model.PageProperties;
import java.util.List;

/** Builds the uploaded text and display label of a page. */
final class PageDocuments {

  static final String TYPE_PROPERTY = "Type";
  static final String TAGS_PROPERTY = "Tags";
  static final String URL_PROPERTY = "URL";

  private static final int LABEL_TITLE_LENGTH = 50;

  private PageDocuments() {}

  /**
   * Prefixes the body with a metadata header: title, then type, tags and reference URL when set,
   * then a {@code ---} separator line.
   */
  static String compose(PageProperties page, String body) {
    StringBuilder sb = new StringBuilder();
    sb.append("[Title: ").append(page.title()).append(']');
    String type = page.text(TYPE_PROPERTY);
    if (!type.isEmpty()) {
      sb.append("\n[Type: ").append(type).append(']');
    }
    List<String> tags = page.values(TAGS_PROPERTY);
    if (!tags.isEmpty()) {
      sb.append("\n[Tags: ").append(String.join(", ", tags)).append(']');
    }
    String url = page.text(URL_PROPERTY);
    if (!url.isEmpty()) {
      sb.append("\n[Reference: ").append(url).append(']');
    }
    sb.append("\n---\n").append(body);
    return sb.toString();
  }

  /** {@code [pageId] title}, with the title cut to fifty characters. */
  static String displayLabel(String pageId, String title) {
    String shortTitle = title;
    if (title.codePointCount(0, title.length()) > LABEL_TITLE_LENGTH) {
      shortTitle = title.substring(0, title.offsetByCodePoints(0, LABEL_TITLE_LENGTH));
    }
    return "[" + pageId + "] " + shortTitle;
  }
}
