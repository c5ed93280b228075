package com.flamingo.ai.notionrag.ledger;

import java.util.Locale;

/** Granularity of a billing report. */
public enum BillingPeriod {
  TOTAL(0),
  DAILY(10),
  MONTHLY(7);

  private final int keyLength;

  BillingPeriod(int keyLength) {
    this.keyLength = keyLength;
  }

  /**
   * Parses {@code total}, {@code daily} or {@code monthly}, case-insensitively.
   *
   * @throws IllegalArgumentException for anything else
   */
  public static BillingPeriod fromValue(String value) {
    if (value != null) {
      for (BillingPeriod period : values()) {
        if (period.name().equalsIgnoreCase(value.trim())) {
          return period;
        }
      }
    }
    throw new IllegalArgumentException(
        "Invalid period: " + value + ". Use 'total', 'daily', or 'monthly'.");
  }

  /** Grouping key of an ISO-8601 timestamp, e.g. {@code 2025-01-31} for daily. */
  String keyOf(String timestamp) {
    return timestamp.length() < keyLength ? timestamp : timestamp.substring(0, keyLength);
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
