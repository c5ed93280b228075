package com.flamingo.ai.notionrag.api.rest;

import com.flamingo.ai.notionrag.api.dto.response.BillingResponse;
import com.flamingo.ai.notionrag.ledger.BillingPeriod;
import com.flamingo.ai.notionrag.ledger.BillingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for cost reports. */
@RestController
@RequestMapping("/api/billing")
@RequiredArgsConstructor
public class BillingController {

  private final BillingService billingService;

  /** Aggregated costs for {@code total}, {@code daily} or {@code monthly}. */
  @GetMapping
  public ResponseEntity<BillingResponse> billing(
      @RequestParam(defaultValue = "total") String period) {
    return ResponseEntity.ok(
        BillingResponse.from(billingService.summarize(BillingPeriod.fromValue(period))));
  }
}
