package com.flamingo.ai.notionrag.extraction;

import java.util.List;

/**
 * Rendered body of one page.
 *
 * @param text normalized text, lines joined with {@code \n}
 * @param imageCost summed USD cost of every image analysis performed
 * @param images one record per image that was sent for analysis, in document order
 */
public record ExtractedDocument(String text, double imageCost, List<ImageAnalysisRecord> images) {

  public ExtractedDocument {
    text = text == null ? "" : text;
    images = images == null ? List.of() : List.copyOf(images);
  }
}
