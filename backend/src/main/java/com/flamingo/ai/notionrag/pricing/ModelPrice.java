package com.flamingo.ai.notionrag.pricing;

/** Published price of a model in USD per million tokens. */
public record ModelPrice(double inputPerMillion, double outputPerMillion) {

  public static final ModelPrice FREE = new ModelPrice(0.0, 0.0);

  public double cost(long inputTokens, long outputTokens) {
    return (inputTokens / 1_000_000.0 * inputPerMillion)
        + (outputTokens / 1_000_000.0 * outputPerMillion);
  }
}
