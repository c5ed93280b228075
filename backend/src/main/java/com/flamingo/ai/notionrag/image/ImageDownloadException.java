package com.flamingo.ai.notionrag.image;

/** Thrown when an image cannot be fetched. Handled inside the image package, never propagated. */
public class ImageDownloadException extends RuntimeException {

  public ImageDownloadException(String message, Throwable cause) {
    super(message, cause);
  }

  public ImageDownloadException(String message) {
    super(message);
  }
}
