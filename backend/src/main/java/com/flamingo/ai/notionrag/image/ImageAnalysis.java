package com.flamingo.ai.notionrag.image;

import java.time.Duration;

/**
 * Result of analyzing one image.
 *
 * @param classification what the image shows, or {@link ImageClassification#ERROR}
 * @param description short summary, or the failure message when the analysis failed
 * @param code verbatim code or terminal output, empty when none
 * @param cost USD cost of the model call
 * @param elapsed wall time including the download
 */
public record ImageAnalysis(
    ImageClassification classification,
    String description,
    String code,
    double cost,
    Duration elapsed) {

  public ImageAnalysis {
    description = description == null ? "" : description;
    code = code == null ? "" : code;
    elapsed = elapsed == null ? Duration.ZERO : elapsed;
  }

  public static ImageAnalysis failed(String message, Duration elapsed) {
    return new ImageAnalysis(ImageClassification.ERROR, message, "", 0.0, elapsed);
  }

  public boolean isFailed() {
    return classification == ImageClassification.ERROR;
  }
}
