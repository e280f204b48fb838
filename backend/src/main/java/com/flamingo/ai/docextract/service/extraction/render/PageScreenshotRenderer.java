package com.flamingo.ai.docextract.service.extraction.render;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.ExtractionSession;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

/** Rasterises a whole page to PNG so that scanned pages can be sent to the vision model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageScreenshotRenderer {

  public static final String MIME_TYPE = "image/png";

  private final ExtractionConfig config;

  /**
   * Renders {@code pageNumber} at the configured DPI.
   *
   * @param session the extraction call
   * @param pageNumber 1-based page number
   * @return PNG bytes, or empty if rendering is disabled or fails
   */
  public Optional<byte[]> renderPage(ExtractionSession session, int pageNumber) {
    if (!config.getRender().isEnabled()) {
      return Optional.empty();
    }
    float dpi = config.getRender().getDpi();
    try {
      byte[] png =
          session.withDocument(
              document -> {
                if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
                  throw new IOException("Invalid page number: " + pageNumber);
                }
                PDFRenderer renderer = new PDFRenderer(document);
                BufferedImage image =
                    renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.RGB);
                ByteArrayOutputStream baos = new ByteArrayOutputStream();
                ImageIO.write(image, "png", baos);
                return baos.toByteArray();
              });
      log.debug("Rendered page {} at {} DPI ({} bytes)", pageNumber, dpi, png.length);
      return Optional.of(png);
    } catch (IOException | RuntimeException e) {
      log.warn("Could not render page {}: {}", pageNumber, e.getMessage());
    } catch (LinkageError e) {
      // Headless JVMs without AWT native libraries cannot rasterise.
      log.warn("Page rendering unavailable in this runtime: {}", e.toString());
    }
    return Optional.empty();
  }
}
