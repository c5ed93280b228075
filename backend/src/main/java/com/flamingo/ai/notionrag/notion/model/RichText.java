package com.flamingo.ai.notionrag.notion.model;

/** One run of a Notion rich_text array. Only the rendered plain text and link are kept. */
public record RichText(String plainText, String href) {

  public RichText {
    plainText = plainText == null ? "" : plainText;
  }

  public static RichText of(String plainText) {
    return new RichText(plainText, null);
  }
}
