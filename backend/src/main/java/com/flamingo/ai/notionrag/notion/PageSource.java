package com.flamingo.ai.notionrag.notion;

import com.flamingo.ai.notionrag.notion.model.BlockChildrenPage;
import com.flamingo.ai.notionrag.notion.model.PageProperties;
import java.time.Instant;
import java.util.List;

/** Read-only access to the hierarchical document source. */
public interface PageSource {

  /**
   * Lists the ids of all pages in a database, following pagination.
   *
   * @param databaseId normalized database id
   * @param modifiedSince when non-null, only pages edited on or after this instant
   * @return normalized page ids in source order
   */
  List<String> listPages(String databaseId, Instant modifiedSince);

  /**
   * Fetches a page's metadata.
   *
   * @param pageId normalized page id
   * @return the page properties
   */
  PageProperties getPageProperties(String pageId);

  /**
   * Lists one page of a block's children.
   *
   * @param blockId the parent block (or page) id
   * @param cursor opaque cursor from the previous page, or {@code null} for the first page
   * @return blocks plus pagination state
   */
  BlockChildrenPage listBlockChildren(String blockId, String cursor);
}
