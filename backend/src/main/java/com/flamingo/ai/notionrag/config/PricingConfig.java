package com.flamingo.ai.notionrag.config;

import com.flamingo.ai.notionrag.pricing.ModelPrice;
import com.flamingo.ai.notionrag.pricing.PricingTable;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the read-only {@link PricingTable} from {@code notion-rag.pricing}. */
@Configuration
@Slf4j
public class PricingConfig {

  @Bean
  public PricingTable pricingTable(NotionRagConfig config) {
    Map<String, ModelPrice> prices = new HashMap<>();
    config
        .getPricing()
        .forEach(
            (model, price) ->
                prices.put(model, new ModelPrice(price.getInput(), price.getOutput())));

    String embeddingModel = config.getModels().getEmbedding();
    String visionModel = config.getModels().getImageVision();
    if (!prices.containsKey(embeddingModel)) {
      log.warn(
          "No price configured for embedding model '{}', costs will read as 0", embeddingModel);
    }
    if (!prices.containsKey(visionModel)) {
      log.warn("No price configured for vision model '{}', costs will read as 0", visionModel);
    }
    log.info("Loaded pricing for {} model(s)", prices.size());
    return new PricingTable(prices);
  }
}
