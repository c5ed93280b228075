package com.flamingo.ai.notionrag.notion;

import com.flamingo.ai.notionrag.exception.NotionApiException;
import java.util.function.Predicate;

/**
 * Retry predicate for the {@code notion} Resilience4j instance: retries rate limiting, server
 * errors and connection failures, never client errors.
 */
public class NotionRetryPredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof NotionApiException e) {
      int status = e.getStatusCode();
      return status == 0 || status == 429 || status >= 500;
    }
    return false;
  }
}
