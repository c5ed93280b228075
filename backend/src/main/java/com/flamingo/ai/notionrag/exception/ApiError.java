package com.flamingo.ai.notionrag.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_IDENTIFIER = "INPUT_001";
  public static final String UNKNOWN_DATABASE = "DATABASE_001";
  public static final String STORE_NOT_FOUND = "STORE_001";
  public static final String DOCUMENT_NOT_FOUND = "STORE_002";
  public static final String STORE_UNAVAILABLE = "STORE_003";
  public static final String NOTION_ERROR = "NOTION_001";
  public static final String NOTION_RATE_LIMITED = "NOTION_002";
  public static final String INDEXING_FAILED = "INDEXING_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
