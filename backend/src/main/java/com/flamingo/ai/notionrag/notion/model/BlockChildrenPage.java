package com.flamingo.ai.notionrag.notion.model;

import java.util.List;

/** One page of a block-children listing. */
public record BlockChildrenPage(List<Block> blocks, boolean hasMore, String nextCursor) {

  public BlockChildrenPage {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }

  public static BlockChildrenPage last(List<Block> blocks) {
    return new BlockChildrenPage(blocks, false, null);
  }
}
