package com.flamingo.ai.notionrag.extraction;

import com.flamingo.ai.notionrag.image.ImageAnalysis;
import java.time.Duration;

/**
 * Per-image line item of an extraction pass, written to the indexing ledger.
 *
 * @param url resolved image URL
 * @param caption block caption, possibly empty
 * @param classification {@code terminal}, {@code diagram}, {@code other} or {@code error}
 * @param cost USD cost of the analysis
 * @param elapsed analysis wall time
 * @param descriptionPreview first 100 code points of the description (or failure message)
 */
public record ImageAnalysisRecord(
    String url,
    String caption,
    String classification,
    double cost,
    Duration elapsed,
    String descriptionPreview) {

  static final int PREVIEW_LENGTH = 100;

  static ImageAnalysisRecord of(String url, String caption, ImageAnalysis analysis) {
    String description = analysis.description();
    String preview = description;
    if (description.codePointCount(0, description.length()) > PREVIEW_LENGTH) {
      preview = description.substring(0, description.offsetByCodePoints(0, PREVIEW_LENGTH));
    }
    return new ImageAnalysisRecord(
        url,
        caption,
        analysis.classification().label(),
        analysis.cost(),
        analysis.elapsed(),
        preview);
  }
}
