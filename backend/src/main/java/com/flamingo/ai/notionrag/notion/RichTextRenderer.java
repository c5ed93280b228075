package com.flamingo.ai.notionrag.notion;

import com.flamingo.ai.notionrag.notion.model.RichText;
import java.util.List;

/** Flattens Notion rich text runs to plain text. */
public final class RichTextRenderer {

  private RichTextRenderer() {}

  /** Concatenates the plain text of every run; formatting and links are dropped. */
  public static String render(List<RichText> runs) {
    if (runs == null || runs.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (RichText run : runs) {
      sb.append(run.plainText());
    }
    return sb.toString();
  }
}
