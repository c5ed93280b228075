package com.flamingo.ai.notionrag.notion.model;

import java.util.List;
import lombok.Builder;

/**
 * A single node of a page's block tree, flattened to the fields the extractor renders.
 *
 * <p>Which fields are populated depends on {@link #kind()}: rich text for text-like blocks, {@code
 * cells} for table rows, {@code url} for bookmarks and link previews, {@code name} for files,
 * {@code title} for child pages and databases, {@code fileUrl}/{@code externalUrl} for images.
 */
@Builder
public record Block(
    String id,
    BlockKind kind,
    String apiType,
    boolean hasChildren,
    List<RichText> richText,
    List<RichText> caption,
    String language,
    boolean checked,
    List<List<RichText>> cells,
    String url,
    String name,
    String title,
    String fileUrl,
    String externalUrl) {

  public Block {
    kind = kind == null ? BlockKind.UNSUPPORTED : kind;
    apiType = apiType == null ? kind.apiType() : apiType;
    richText = richText == null ? List.of() : List.copyOf(richText);
    caption = caption == null ? List.of() : List.copyOf(caption);
    cells = cells == null ? List.of() : cells.stream().map(List::copyOf).toList();
  }

  /**
   * Source URL of an image block: the Notion-hosted file URL when present, otherwise the external
   * URL, otherwise an empty string.
   */
  public String imageUrl() {
    if (fileUrl != null && !fileUrl.isEmpty()) {
      return fileUrl;
    }
    if (externalUrl != null && !externalUrl.isEmpty()) {
      return externalUrl;
    }
    return "";
  }
}
