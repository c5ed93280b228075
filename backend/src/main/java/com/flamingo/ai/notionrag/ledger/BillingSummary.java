package com.flamingo.ai.notionrag.ledger;

import java.util.List;

/** Billing report: grand total plus a chronological breakdown (empty for the total period). */
public record BillingSummary(
    BillingPeriod period, CostBreakdown total, List<CostBreakdown> breakdown) {

  public BillingSummary {
    breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
  }
}
