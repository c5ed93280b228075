package com.flamingo.ai.notionrag.notion.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of Notion block types the extractor knows how to render.
 *
 * <p>Anything the API returns that is not listed maps to {@link #UNSUPPORTED}, which renders no
 * text of its own and only contributes its children.
 */
public enum BlockKind {
  PARAGRAPH("paragraph"),
  HEADING_1("heading_1"),
  HEADING_2("heading_2"),
  HEADING_3("heading_3"),
  BULLETED_LIST_ITEM("bulleted_list_item"),
  NUMBERED_LIST_ITEM("numbered_list_item"),
  TO_DO("to_do"),
  QUOTE("quote"),
  CALLOUT("callout"),
  TOGGLE("toggle"),
  CODE("code"),
  TABLE("table"),
  TABLE_ROW("table_row"),
  DIVIDER("divider"),
  IMAGE("image"),
  BOOKMARK("bookmark"),
  LINK_PREVIEW("link_preview"),
  FILE("file"),
  PDF("pdf"),
  CHILD_PAGE("child_page"),
  CHILD_DATABASE("child_database"),
  COLUMN_LIST("column_list"),
  COLUMN("column"),
  SYNCED_BLOCK("synced_block"),
  UNSUPPORTED("unsupported");

  private static final Map<String, BlockKind> BY_API_TYPE =
      Arrays.stream(values()).collect(Collectors.toMap(BlockKind::apiType, Function.identity()));

  private final String apiType;

  BlockKind(String apiType) {
    this.apiType = apiType;
  }

  /** The {@code type} string used by the Notion API. */
  public String apiType() {
    return apiType;
  }

  /** Heading level 1-3, or 0 for non-heading kinds. */
  public int headingLevel() {
    return switch (this) {
      case HEADING_1 -> 1;
      case HEADING_2 -> 2;
      case HEADING_3 -> 3;
      default -> 0;
    };
  }

  /**
   * Containers whose children are rendered at the parent's depth and which never go through the
   * generic child recursion.
   */
  public boolean isTransparentContainer() {
    return this == TABLE || this == COLUMN_LIST || this == COLUMN || this == SYNCED_BLOCK;
  }

  public static BlockKind fromApiType(String apiType) {
    if (apiType == null) {
      return UNSUPPORTED;
    }
    return BY_API_TYPE.getOrDefault(apiType, UNSUPPORTED);
  }
}
