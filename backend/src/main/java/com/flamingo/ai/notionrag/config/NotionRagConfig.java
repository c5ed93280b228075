package com.flamingo.ai.notionrag.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the Notion mirroring pipeline. */
@Configuration
@ConfigurationProperties(prefix = "notion-rag")
@Getter
@Setter
public class NotionRagConfig {

  private Notion notion = new Notion();
  private Models models = new Models();
  private Sync sync = new Sync();
  private Extraction extraction = new Extraction();
  private Image image = new Image();
  private Store store = new Store();
  private Registry registry = new Registry();
  private Ledger ledger = new Ledger();

  /** USD per million tokens, keyed by model name. */
  private Map<String, Price> pricing = new LinkedHashMap<>();

  @Getter
  @Setter
  public static class Notion {
    private String token = "";
    private String baseUrl = "https://api.notion.com/v1";
    private String apiVersion = "2025-09-03";
    private int pageSize = 100;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Models {
    private String embedding = "text-embedding-3-small";
    private String imageVision = "gpt-4o-mini";
  }

  @Getter
  @Setter
  public static class Sync {
    /** Trailing window, in days, for incremental sync. */
    private int syncDays = 2;

    /** Wait after a batch of uploads so the store can finish indexing. */
    private Duration settleDelay = Duration.ofSeconds(5);

    private Duration pollInterval = Duration.ofSeconds(2);

    /** Upper bound on completion polls per upload; exceeding it fails the page. */
    private int pollMaxAttempts = 150;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Deepest block nesting that is walked; deeper subtrees are skipped with a warning. */
    private int maxDepth = 32;
  }

  @Getter
  @Setter
  public static class Image {
    private Duration downloadTimeout = Duration.ofSeconds(30);
    private int maxBytes = 20 * 1024 * 1024;
    private List<String> supportedMimeTypes =
        List.of("image/png", "image/jpeg", "image/webp", "image/heic", "image/heif");
  }

  @Getter
  @Setter
  public static class Store {
    private String scheme = "http";
    private String host = "localhost";
    private int port = 9200;

    /** Elasticsearch API key; requests are unauthenticated when blank. */
    private String apiKey = "";

    private String indexPrefix = "notion-rag-";
    private int vectorDimensions = 1536;
    private int listPageSize = 500;
  }

  @Getter
  @Setter
  public static class Registry {
    private String path = "settings.json";
  }

  @Getter
  @Setter
  public static class Ledger {
    private String baseDir = "logs";
  }

  @Getter
  @Setter
  public static class Price {
    private double input;
    private double output;
  }
}
