package com.flamingo.ai.notionrag.ledger;

/**
 * Aggregated cost for one period, rounded to eight decimals.
 *
 * @param period {@code YYYY-MM-DD}, {@code YYYY-MM}, or {@code null} for the grand total
 */
public record CostBreakdown(
    String period, double embeddingCost, double visionCost, double totalCost) {}
