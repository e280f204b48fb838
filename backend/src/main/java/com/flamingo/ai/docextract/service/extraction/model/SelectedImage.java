package com.flamingo.ai.docextract.service.extraction.model;

/**
 * An embedded page image chosen for OCR.
 *
 * @param pixelWidth width in pixels
 * @param pixelHeight height in pixels
 * @param data encoded image bytes
 * @param mimeType MIME type of {@code data}
 */
public record SelectedImage(int pixelWidth, int pixelHeight, byte[] data, String mimeType) {

  public long area() {
    return (long) pixelWidth * pixelHeight;
  }
}
