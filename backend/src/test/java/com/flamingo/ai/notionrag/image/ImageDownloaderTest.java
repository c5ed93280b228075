package com.flamingo.ai.notionrag.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.notionrag.config.NotionRagConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@DisplayName("ImageDownloader Tests")
class ImageDownloaderTest {

  private ImageDownloader downloaderReturning(ClientResponse response) {
    WebClient webClient =
        WebClient.builder().exchangeFunction(request -> Mono.just(response)).build();
    return new ImageDownloader(webClient, new NotionRagConfig());
  }

  @Test
  @DisplayName("Should return bytes with the normalized content type")
  void shouldReturnBytesAndMimeType() {
    byte[] payload = {1, 2, 3};
    ClientResponse response =
        ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, "Image/JPEG; charset=binary")
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(payload)))
            .build();

    DownloadedImage image = downloaderReturning(response).download("https://img/x.jpg");

    assertThat(image.bytes()).containsExactly(1, 2, 3);
    assertThat(image.mimeType()).isEqualTo("image/jpeg");
  }

  @Test
  @DisplayName("Should default the content type to PNG")
  void shouldDefaultToPng() {
    ClientResponse response =
        ClientResponse.create(HttpStatus.OK)
            .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(new byte[] {9})))
            .build();

    assertThat(downloaderReturning(response).download("https://img/x").mimeType())
        .isEqualTo("image/png");
  }

  @Test
  @DisplayName("Should report HTTP errors with their status code")
  void shouldReportHttpErrors() {
    ClientResponse response = ClientResponse.create(HttpStatus.FORBIDDEN).build();

    assertThatThrownBy(() -> downloaderReturning(response).download("https://img/x.png"))
        .isInstanceOf(ImageDownloadException.class)
        .hasMessageStartingWith("HTTP 403");
  }
}
