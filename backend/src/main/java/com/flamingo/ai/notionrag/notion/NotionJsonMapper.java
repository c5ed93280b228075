package com.flamingo.ai.notionrag.notion;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.notionrag.notion.model.Block;
import com.flamingo.ai.notionrag.notion.model.BlockChildrenPage;
import com.flamingo.ai.notionrag.notion.model.BlockKind;
import com.flamingo.ai.notionrag.notion.model.PageProperties;
import com.flamingo.ai.notionrag.notion.model.PropertyValue;
import com.flamingo.ai.notionrag.notion.model.PropertyValue.PropertyType;
import com.flamingo.ai.notionrag.notion.model.RichText;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Converts Notion API JSON payloads into the service's block and page model. */
@Slf4j
public final class NotionJsonMapper {

  private NotionJsonMapper() {}

  public static BlockChildrenPage toChildrenPage(JsonNode response) {
    List<Block> blocks = new ArrayList<>();
    for (JsonNode node : response.path("results")) {
      blocks.add(toBlock(node));
    }
    boolean hasMore = response.path("has_more").asBoolean(false);
    String nextCursor = textOrNull(response.path("next_cursor"));
    return new BlockChildrenPage(blocks, hasMore, nextCursor);
  }

  public static Block toBlock(JsonNode node) {
    String apiType = node.path("type").asText("");
    BlockKind kind = BlockKind.fromApiType(apiType);
    JsonNode data = node.path(apiType);

    List<List<RichText>> cells = new ArrayList<>();
    for (JsonNode cell : data.path("cells")) {
      cells.add(toRichText(cell));
    }

    return Block.builder()
        .id(node.path("id").asText(""))
        .kind(kind)
        .apiType(apiType)
        .hasChildren(node.path("has_children").asBoolean(false))
        .richText(toRichText(data.path("rich_text")))
        .caption(toRichText(data.path("caption")))
        .language(data.path("language").asText(""))
        .checked(data.path("checked").asBoolean(false))
        .cells(cells)
        .url(data.path("url").asText(""))
        .name(data.path("name").asText(""))
        .title(data.path("title").asText(""))
        .fileUrl(data.path("file").path("url").asText(""))
        .externalUrl(data.path("external").path("url").asText(""))
        .build();
  }

  public static List<RichText> toRichText(JsonNode array) {
    if (array == null || !array.isArray()) {
      return List.of();
    }
    List<RichText> runs = new ArrayList<>(array.size());
    for (JsonNode run : array) {
      runs.add(new RichText(run.path("plain_text").asText(""), textOrNull(run.path("href"))));
    }
    return runs;
  }

  /**
   * Reads id, {@code last_edited_time}, title and the select, multi-select, url and rich text
   * properties of a page object. Other property types are ignored.
   */
  public static PageProperties toPageProperties(JsonNode page) {
    String id = NotionIds.normalize(page.path("id").asText(""));
    String lastEdited = page.path("last_edited_time").asText("");
    String title = "";
    Map<String, PropertyValue> properties = new LinkedHashMap<>();

    for (Map.Entry<String, JsonNode> field : page.path("properties").properties()) {
      String name = field.getKey();
      JsonNode prop = field.getValue();
      switch (prop.path("type").asText("")) {
        case "title" -> {
          title = RichTextRenderer.render(toRichText(prop.path("title")));
          properties.put(name, PropertyValue.text(PropertyType.TITLE, title));
        }
        case "select" -> {
          JsonNode select = prop.path("select");
          if (!select.isNull() && !select.isMissingNode()) {
            properties.put(
                name, PropertyValue.text(PropertyType.SELECT, select.path("name").asText("")));
          }
        }
        case "multi_select" -> {
          List<String> options = new ArrayList<>();
          for (JsonNode option : prop.path("multi_select")) {
            options.add(option.path("name").asText(""));
          }
          properties.put(name, PropertyValue.multiSelect(options));
        }
        case "url" -> {
          String url = textOrNull(prop.path("url"));
          properties.put(name, PropertyValue.text(PropertyType.URL, url == null ? "" : url));
        }
        case "rich_text" ->
            properties.put(
                name,
                PropertyValue.text(
                    PropertyType.RICH_TEXT,
                    RichTextRenderer.render(toRichText(prop.path("rich_text")))));
        default -> log.trace("Ignoring property '{}' of type {}", name, prop.path("type"));
      }
    }
    return new PageProperties(id, lastEdited, title, properties);
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    return node.asText();
  }
}
