package com.flamingo.ai.notionrag.extraction;

import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.image.ImageAnalysis;
import com.flamingo.ai.notionrag.image.ImageAnalyzer;
import com.flamingo.ai.notionrag.image.ImageClassification;
import com.flamingo.ai.notionrag.notion.PageSource;
import com.flamingo.ai.notionrag.notion.RichTextRenderer;
import com.flamingo.ai.notionrag.notion.model.Block;
import com.flamingo.ai.notionrag.notion.model.BlockChildrenPage;
import com.google.common.base.Strings;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks a page's block tree depth-first and renders it to Markdown-flavoured plain text.
 *
 * <p>Children are fetched page by page until the listing is exhausted, so source order is kept.
 * Nested blocks are indented two spaces per level. Table, column and synced-block containers are
 * transparent: their children render at the container's own depth. Images are described by the
 * {@link ImageAnalyzer} and their cost is accumulated into the result.
 *
 * <p>Recursion stops at {@code notion-rag.extraction.max-depth}. A block is not entered again
 * while it is still an ancestor on the current path; the same subtree reached through two
 * different parents renders twice.
 */
@Service
@Slf4j
public class BlockTreeExtractor {

  private static final String INDENT_UNIT = "  ";

  private final PageSource pageSource;
  private final ImageAnalyzer imageAnalyzer;
  private final int maxDepth;

  public BlockTreeExtractor(
      PageSource pageSource, ImageAnalyzer imageAnalyzer, NotionRagConfig config) {
    this.pageSource = pageSource;
    this.imageAnalyzer = imageAnalyzer;
    this.maxDepth = config.getExtraction().getMaxDepth();
  }

  /**
   * Renders every block below {@code rootBlockId}.
   *
   * @param rootBlockId page or block id whose children are rendered
   * @return rendered text with accumulated image cost
   */
  @Timed(value = "extraction.page", description = "Time to walk and render a page's blocks")
  public ExtractedDocument extract(String rootBlockId) {
    Walk walk = new Walk();
    walk.ancestors.add(rootBlockId);
    walkChildren(rootBlockId, 0, walk);
    log.debug(
        "Extracted {} lines and {} images from {}",
        walk.lines.size(),
        walk.images.size(),
        rootBlockId);
    return new ExtractedDocument(String.join("\n", walk.lines), walk.imageCost, walk.images);
  }

  private void walkChildren(String blockId, int depth, Walk walk) {
    String cursor = null;
    do {
      BlockChildrenPage page = pageSource.listBlockChildren(blockId, cursor);
      for (Block block : page.blocks()) {
        render(block, depth, walk);
      }
      cursor = page.hasMore() ? page.nextCursor() : null;
    } while (cursor != null);
  }

  private void render(Block block, int depth, Walk walk) {
    if (block.kind().isTransparentContainer()) {
      if (block.hasChildren()) {
        descend(block, depth, walk);
      }
      return;
    }

    String indent = INDENT_UNIT.repeat(depth);
    List<String> lines = walk.lines;

    switch (block.kind()) {
      case PARAGRAPH -> addText(lines, indent, "", block);
      case BULLETED_LIST_ITEM -> addText(lines, indent, "- ", block);
      case NUMBERED_LIST_ITEM -> addText(lines, indent, "1. ", block);
      case TO_DO -> addText(lines, indent, block.checked() ? "- [x] " : "- [ ] ", block);
      case QUOTE -> addText(lines, indent, "> ", block);
      case CALLOUT -> addText(lines, indent, "> [!NOTE] ", block);
      case TOGGLE -> addText(lines, indent, "▶ ", block);
      case HEADING_1, HEADING_2, HEADING_3 -> {
        String text = RichTextRenderer.render(block.richText());
        if (!text.isEmpty()) {
          lines.add("\n" + "#".repeat(block.kind().headingLevel()) + " " + text);
        }
      }
      case CODE -> {
        String text = RichTextRenderer.render(block.richText());
        if (!text.isEmpty()) {
          String caption = RichTextRenderer.render(block.caption());
          lines.add(indent + "```" + Strings.nullToEmpty(block.language()));
          lines.add(text);
          lines.add(indent + "```");
          if (!caption.isEmpty()) {
            lines.add(indent + "[Code description: " + caption + "]");
          }
        }
      }
      case TABLE_ROW -> {
        List<String> cells = block.cells().stream().map(RichTextRenderer::render).toList();
        lines.add(indent + "| " + String.join(" | ", cells) + " |");
      }
      case DIVIDER -> lines.add(indent + "---");
      case IMAGE -> {
        renderImage(block, indent, walk);
        return;
      }
      case BOOKMARK -> {
        String url = Strings.nullToEmpty(block.url());
        String caption = RichTextRenderer.render(block.caption());
        if (!caption.isEmpty()) {
          lines.add(indent + "[REF: " + caption + " - " + url + "]");
        } else if (!url.isEmpty()) {
          lines.add(indent + "[REF: " + url + "]");
        }
      }
      case LINK_PREVIEW -> {
        String url = Strings.nullToEmpty(block.url());
        if (!url.isEmpty()) {
          lines.add(indent + "[LINK: " + url + "]");
        }
      }
      case FILE, PDF -> {
        String label = Strings.nullToEmpty(block.name());
        if (label.isEmpty()) {
          label = RichTextRenderer.render(block.caption());
        }
        lines.add(indent + "[FILE: " + (label.isEmpty() ? "attachment" : label) + "]");
      }
      case CHILD_PAGE ->
          lines.add(indent + "[CHILD PAGE: " + Strings.nullToEmpty(block.title()) + "]");
      case CHILD_DATABASE ->
          lines.add(indent + "[CHILD DB: " + Strings.nullToEmpty(block.title()) + "]");
      case UNSUPPORTED -> log.warn(
          "Block {} has unsupported type '{}'; only its children are rendered",
          block.id(),
          block.apiType());
    }

    if (block.hasChildren()) {
      descend(block, depth + 1, walk);
    }
  }

  private void descend(Block block, int depth, Walk walk) {
    if (depth > maxDepth) {
      log.warn("Skipping children of block {}: nesting exceeds depth {}", block.id(), maxDepth);
      return;
    }
    if (!walk.ancestors.add(block.id())) {
      log.warn("Skipping block {}: it contains itself", block.id());
      return;
    }
    try {
      walkChildren(block.id(), depth, walk);
    } finally {
      walk.ancestors.remove(block.id());
    }
  }

  private void renderImage(Block block, String indent, Walk walk) {
    String caption = RichTextRenderer.render(block.caption());
    String url = block.imageUrl();
    if (url.isEmpty()) {
      walk.lines.add(placeholder(indent, caption));
      return;
    }

    ImageAnalysis analysis = imageAnalyzer.analyze(url, caption);
    walk.imageCost += analysis.cost();
    walk.images.add(ImageAnalysisRecord.of(url, caption, analysis));

    if (analysis.isFailed()) {
      log.warn("Image in block {} rendered as placeholder: {}", block.id(), analysis.description());
      walk.lines.add(placeholder(indent, caption));
      return;
    }

    String description = analysis.description();
    String code = analysis.code();
    if (analysis.classification() == ImageClassification.TERMINAL) {
      if (!description.isEmpty()) {
        walk.lines.add("\n" + indent + description);
      }
      if (!code.isEmpty()) {
        walk.lines.add("\n" + indent + "```\n" + code + "\n" + indent + "```\n");
      }
      return;
    }

    String label = caption.isEmpty() ? "Image" : "Image: " + caption;
    if (!description.isEmpty()) {
      walk.lines.add(
          "\n\n" + indent + "**[" + label + "]**\n" + indent + description + "\n" + indent
              + "**[/" + label + "]**\n\n");
    }
    if (!code.isEmpty()) {
      walk.lines.add(indent + "```\n" + code + "\n" + indent + "```\n");
    }
  }

  private static String placeholder(String indent, String caption) {
    return caption.isEmpty() ? indent + "[IMAGE]" : indent + "[IMAGE: " + caption + "]";
  }

  private static void addText(List<String> lines, String indent, String prefix, Block block) {
    String text = RichTextRenderer.render(block.richText());
    if (!text.isEmpty()) {
      lines.add(indent + prefix + text);
    }
  }

  /** Mutable state of one extraction pass. */
  private static final class Walk {
    private final List<String> lines = new ArrayList<>();
    private final List<ImageAnalysisRecord> images = new ArrayList<>();
    private final Set<String> ancestors = new HashSet<>();
    private double imageCost;
  }
}
