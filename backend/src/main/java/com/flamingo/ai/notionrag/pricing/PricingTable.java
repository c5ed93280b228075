package com.flamingo.ai.notionrag.pricing;

import java.util.Map;

/**
 * Immutable model price table, loaded once at start-up.
 *
 * <p>Unknown models are priced at zero.
 */
public final class PricingTable {

  private final Map<String, ModelPrice> prices;

  public PricingTable(Map<String, ModelPrice> prices) {
    this.prices = Map.copyOf(prices);
  }

  public ModelPrice priceOf(String model) {
    return prices.getOrDefault(model, ModelPrice.FREE);
  }

  /** USD cost of a call that consumed the given token counts. */
  public double cost(String model, long inputTokens, long outputTokens) {
    return priceOf(model).cost(inputTokens, outputTokens);
  }

  public Map<String, ModelPrice> asMap() {
    return prices;
  }
}
