package com.flamingo.ai.notionrag.exception;

/** Thrown when an uploaded artifact does not become searchable within the poll budget. */
public class UploadTimeoutException extends RuntimeException {

  private final String artifactId;
  private final int attempts;

  public UploadTimeoutException(String artifactId, int attempts) {
    super(
        String.format(
            "Artifact %s was not reported as indexed after %d status polls", artifactId, attempts));
    this.artifactId = artifactId;
    this.attempts = attempts;
  }

  public String getArtifactId() {
    return artifactId;
  }

  public int getAttempts() {
    return attempts;
  }
}
