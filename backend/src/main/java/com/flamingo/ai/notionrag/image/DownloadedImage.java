package com.flamingo.ai.notionrag.image;

/**
 * Raw image bytes with the MIME type taken from the {@code Content-Type} header.
 *
 * @param bytes image content
 * @param mimeType lower-case type without parameters, e.g. {@code image/png}
 */
public record DownloadedImage(byte[] bytes, String mimeType) {}
