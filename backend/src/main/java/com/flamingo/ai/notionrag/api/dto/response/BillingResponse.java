package com.flamingo.ai.notionrag.api.dto.response;

import com.flamingo.ai.notionrag.ledger.BillingSummary;
import com.flamingo.ai.notionrag.ledger.CostBreakdown;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a billing report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillingResponse {

  private String period;
  private Cost total;
  private List<Cost> breakdown;

  public static BillingResponse from(BillingSummary summary) {
    return BillingResponse.builder()
        .period(summary.period().value())
        .total(Cost.from(summary.total()))
        .breakdown(summary.breakdown().stream().map(Cost::from).toList())
        .build();
  }

  /** Costs of one period in USD. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Cost {
    private String period;
    private double embeddingCost;
    private double visionCost;
    private double totalCost;

    static Cost from(CostBreakdown breakdown) {
      return new Cost(
          breakdown.period(),
          breakdown.embeddingCost(),
          breakdown.visionCost(),
          breakdown.totalCost());
    }
  }
}
