package com.flamingo.ai.notionrag.image;

import com.flamingo.ai.notionrag.config.NotionRagConfig;
import java.time.Duration;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Fetches image bytes over HTTP, following redirects, within the configured timeout. */
@Component
@Slf4j
public class ImageDownloader {

  private static final String DEFAULT_MIME_TYPE = MediaType.IMAGE_PNG_VALUE;

  private final WebClient webClient;
  private final Duration timeout;

  public ImageDownloader(@Qualifier("imageWebClient") WebClient webClient, NotionRagConfig config) {
    this.webClient = webClient;
    this.timeout = config.getImage().getDownloadTimeout();
  }

  /**
   * Downloads an image.
   *
   * @throws ImageDownloadException on any HTTP, network or timeout failure
   */
  public DownloadedImage download(String url) {
    ResponseEntity<byte[]> response;
    try {
      response = webClient.get().uri(url).retrieve().toEntity(byte[].class).block(timeout);
    } catch (WebClientResponseException e) {
      throw new ImageDownloadException(
          "HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
    } catch (WebClientRequestException e) {
      throw new ImageDownloadException(e.getMessage(), e);
    } catch (RuntimeException e) {
      // timeouts and buffer overflows surface as plain runtime exceptions from block()
      throw new ImageDownloadException(e.getMessage(), e);
    }

    if (response == null || response.getBody() == null) {
      throw new ImageDownloadException("empty response body");
    }
    MediaType contentType = response.getHeaders().getContentType();
    String mimeType =
        contentType == null
            ? DEFAULT_MIME_TYPE
            : (contentType.getType() + "/" + contentType.getSubtype()).toLowerCase(Locale.ROOT);
    log.debug("Downloaded {} bytes ({}) from image URL", response.getBody().length, mimeType);
    return new DownloadedImage(response.getBody(), mimeType);
  }
}
