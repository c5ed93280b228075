package com.flamingo.ai.notionrag.notion;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.notionrag.notion.model.Block;
import com.flamingo.ai.notionrag.notion.model.BlockChildrenPage;
import com.flamingo.ai.notionrag.notion.model.BlockKind;
import com.flamingo.ai.notionrag.notion.model.PageProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("NotionJsonMapper Tests")
class NotionJsonMapperTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private JsonNode json(String text) throws Exception {
    return objectMapper.readTree(text);
  }

  @Nested
  @DisplayName("Block children")
  class BlockChildren {

    @Test
    @DisplayName("Should map paragraph text and pagination state")
    void shouldMapParagraphAndPagination() throws Exception {
      BlockChildrenPage page =
          NotionJsonMapper.toChildrenPage(
              json(
                  """
                  {"results": [{"id": "b1", "type": "paragraph", "has_children": true,
                    "paragraph": {"rich_text": [{"plain_text": "Hel"}, {"plain_text": "lo"}]}}],
                   "has_more": true, "next_cursor": "cur-2"}
                  """));

      assertThat(page.hasMore()).isTrue();
      assertThat(page.nextCursor()).isEqualTo("cur-2");
      Block block = page.blocks().get(0);
      assertThat(block.kind()).isEqualTo(BlockKind.PARAGRAPH);
      assertThat(block.hasChildren()).isTrue();
      assertThat(RichTextRenderer.render(block.richText())).isEqualTo("Hello");
    }

    @Test
    @DisplayName("Should treat a null cursor as absent")
    void shouldTreatNullCursorAsAbsent() throws Exception {
      BlockChildrenPage page =
          NotionJsonMapper.toChildrenPage(
              json("{\"results\": [], \"has_more\": false, \"next_cursor\": null}"));

      assertThat(page.blocks()).isEmpty();
      assertThat(page.hasMore()).isFalse();
      assertThat(page.nextCursor()).isNull();
    }

    @Test
    @DisplayName("Should map table row cells")
    void shouldMapTableRowCells() throws Exception {
      Block block =
          NotionJsonMapper.toBlock(
              json(
                  """
                  {"id": "r1", "type": "table_row",
                   "table_row": {"cells": [[{"plain_text": "A"}], [{"plain_text": "B"}]]}}
                  """));

      assertThat(block.kind()).isEqualTo(BlockKind.TABLE_ROW);
      assertThat(block.cells()).hasSize(2);
      assertThat(RichTextRenderer.render(block.cells().get(1))).isEqualTo("B");
    }

    @Test
    @DisplayName("Should prefer the hosted file URL of an image")
    void shouldPreferHostedImageUrl() throws Exception {
      Block hosted =
          NotionJsonMapper.toBlock(
              json(
                  """
                  {"id": "i1", "type": "image",
                   "image": {"type": "file", "file": {"url": "https://files/x.png"},
                             "caption": [{"plain_text": "arch"}]}}
                  """));
      Block external =
          NotionJsonMapper.toBlock(
              json(
                  """
                  {"id": "i2", "type": "image",
                   "image": {"type": "external", "external": {"url": "https://ext/y.png"}}}
                  """));

      assertThat(hosted.imageUrl()).isEqualTo("https://files/x.png");
      assertThat(RichTextRenderer.render(hosted.caption())).isEqualTo("arch");
      assertThat(external.imageUrl()).isEqualTo("https://ext/y.png");
    }

    @Test
    @DisplayName("Should map unknown block types to UNSUPPORTED and keep the API type")
    void shouldMapUnknownTypes() throws Exception {
      Block block =
          NotionJsonMapper.toBlock(
              json("{\"id\": \"e1\", \"type\": \"equation\", \"has_children\": false}"));

      assertThat(block.kind()).isEqualTo(BlockKind.UNSUPPORTED);
      assertThat(block.apiType()).isEqualTo("equation");
    }
  }

  @Nested
  @DisplayName("Page properties")
  class Properties {

    @Test
    @DisplayName("Should read title, select, multi-select and url properties")
    void shouldReadProperties() throws Exception {
      PageProperties page =
          NotionJsonMapper.toPageProperties(
              json(
                  """
                  {"id": "286c479a-8fc2-1c80-7d13-4a19e9ae7065",
                   "last_edited_time": "2025-01-02T03:04:00.000Z",
                   "properties": {
                     "Name": {"type": "title", "title": [{"plain_text": "Setup guide"}]},
                     "Type": {"type": "select", "select": {"name": "How-to"}},
                     "Tags": {"type": "multi_select",
                              "multi_select": [{"name": "ops"}, {"name": "k8s"}]},
                     "URL": {"type": "url", "url": "https://example.com"},
                     "Count": {"type": "number", "number": 3}
                   }}
                  """));

      assertThat(page.id()).isEqualTo("286c479a8fc21c807d134a19e9ae7065");
      assertThat(page.lastEdited()).isEqualTo("2025-01-02T03:04:00.000Z");
      assertThat(page.title()).isEqualTo("Setup guide");
      assertThat(page.text("Type")).isEqualTo("How-to");
      assertThat(page.values("Tags")).containsExactly("ops", "k8s");
      assertThat(page.text("URL")).isEqualTo("https://example.com");
      assertThat(page.properties()).doesNotContainKey("Count");
    }

    @Test
    @DisplayName("Should default an empty title to Untitled and skip a null select")
    void shouldDefaultEmptyTitle() throws Exception {
      PageProperties page =
          NotionJsonMapper.toPageProperties(
              json(
                  """
                  {"id": "286c479a8fc21c807d134a19e9ae7065",
                   "last_edited_time": "2025-01-02T03:04:00.000Z",
                   "properties": {
                     "Name": {"type": "title", "title": []},
                     "Type": {"type": "select", "select": null}
                   }}
                  """));

      assertThat(page.title()).isEqualTo(PageProperties.UNTITLED);
      assertThat(page.text("Type")).isEmpty();
    }
  }
}
