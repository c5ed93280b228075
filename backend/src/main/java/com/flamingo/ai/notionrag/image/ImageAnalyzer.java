package com.flamingo.ai.notionrag.image;

import com.flamingo.ai.notionrag.config.NotionRagConfig;
import com.flamingo.ai.notionrag.exception.LlmServiceException;
import com.flamingo.ai.notionrag.pricing.PricingTable;
import com.google.common.base.Stopwatch;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Base64;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Describes images embedded in pages with a vision model.
 *
 * <p>Download problems and unsupported formats fail closed: the result is {@link
 * ImageClassification#ERROR} with a bracketed message and zero cost. A failing model call is
 * raised as {@link LlmServiceException} and fails the page.
 */
@Service
@Slf4j
public class ImageAnalyzer {

  static final String PROMPT =
      """
      Analyze this image and answer in exactly the format below.

      TYPE: terminal or diagram or other
      (terminal = terminal/shell/command output/console capture,
      diagram = diagram/flowchart/architecture drawing,
      other = any other screenshot, table, chart, photo)

      DESCRIPTION: one or two sentences with the key content of the image (no code blocks)

      CODE:
      If the image contains code or command output, extract it wrapped in ```.
      Otherwise leave empty.

      Rules:
      - DESCRIPTION is at most two sentences. Be concise.
      - For terminal images keep DESCRIPTION short and put the essential commands/output in CODE.
      - For diagram images summarize the components and the flow in DESCRIPTION.
      - If there is no code, omit the CODE: line entirely.""";

  private final ImageDownloader imageDownloader;
  private final ChatModel visionChatModel;
  private final PricingTable pricingTable;
  private final MeterRegistry meterRegistry;
  private final String modelName;
  private final Set<String> supportedMimeTypes;
  private final int maxBytes;

  public ImageAnalyzer(
      ImageDownloader imageDownloader,
      @Qualifier("visionChatModel") ChatModel visionChatModel,
      PricingTable pricingTable,
      MeterRegistry meterRegistry,
      NotionRagConfig config) {
    this.imageDownloader = imageDownloader;
    this.visionChatModel = visionChatModel;
    this.pricingTable = pricingTable;
    this.meterRegistry = meterRegistry;
    this.modelName = config.getModels().getImageVision();
    this.supportedMimeTypes = Set.copyOf(config.getImage().getSupportedMimeTypes());
    this.maxBytes = config.getImage().getMaxBytes();
  }

  /**
   * Downloads and analyzes one image.
   *
   * @param url image URL
   * @param caption the block caption, passed to the model as a hint when non-empty
   * @return the analysis; {@link ImageAnalysis#isFailed()} when the image was not analyzed
   */
  @Timed(value = "image.analysis", description = "Time to download and describe an image")
  public ImageAnalysis analyze(String url, String caption) {
    Stopwatch stopwatch = Stopwatch.createStarted();

    DownloadedImage image;
    try {
      image = imageDownloader.download(url);
    } catch (ImageDownloadException e) {
      log.warn("Image download failed: {}", e.getMessage());
      meterRegistry.counter("image.analysis.skipped", "reason", "download").increment();
      return ImageAnalysis.failed(
          "[Image could not be downloaded: " + e.getMessage() + "]", stopwatch.elapsed());
    }

    if (!supportedMimeTypes.contains(image.mimeType())) {
      log.info("Skipping image with unsupported format {}", image.mimeType());
      meterRegistry.counter("image.analysis.skipped", "reason", "format").increment();
      return ImageAnalysis.failed(
          "[Image skipped: unsupported format (" + image.mimeType() + ")]", stopwatch.elapsed());
    }
    if (image.bytes().length > maxBytes) {
      log.info("Skipping image of {} bytes (limit {})", image.bytes().length, maxBytes);
      meterRegistry.counter("image.analysis.skipped", "reason", "size").increment();
      return ImageAnalysis.failed(
          "[Image skipped: too large (" + image.bytes().length + " bytes)]", stopwatch.elapsed());
    }

    String prompt =
        caption == null || caption.isEmpty() ? PROMPT : PROMPT + "\n\nCaption: " + caption;
    UserMessage message =
        UserMessage.from(
            TextContent.from(prompt),
            ImageContent.from(Base64.getEncoder().encodeToString(image.bytes()), image.mimeType()));

    ChatResponse response;
    try {
      response = visionChatModel.chat(message);
    } catch (RuntimeException e) {
      meterRegistry.counter("image.analysis.failure").increment();
      throw new LlmServiceException(modelName, "Vision model call failed: " + e.getMessage(), e);
    }

    String raw = response.aiMessage() == null ? "" : response.aiMessage().text();
    double cost = costOf(response.tokenUsage());
    ImageReplyParser.ParsedReply parsed = ImageReplyParser.parse(raw);
    meterRegistry
        .counter("image.analysis.success", "type", parsed.classification().label())
        .increment();

    log.debug(
        "Image analyzed as {} in {} (cost ${})",
        parsed.classification().label(),
        stopwatch,
        String.format("%.8f", cost));
    return new ImageAnalysis(
        parsed.classification(), parsed.description(), parsed.code(), cost, stopwatch.elapsed());
  }

  private double costOf(TokenUsage usage) {
    if (usage == null) {
      return 0.0;
    }
    long input = usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
    long output = usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();
    return pricingTable.cost(modelName, input, output);
  }
}
