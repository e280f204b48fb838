package com.flamingo.ai.docextract.service.extraction;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.image.EmbeddedImageExtractor;
import com.flamingo.ai.docextract.service.extraction.model.ExtractionOptions;
import com.flamingo.ai.docextract.service.extraction.model.PageResult;
import com.flamingo.ai.docextract.service.extraction.model.SelectedImage;
import com.flamingo.ai.docextract.service.extraction.ocr.VisionOcrService;
import com.flamingo.ai.docextract.service.extraction.page.PageTextExtractor;
import com.flamingo.ai.docextract.service.extraction.render.PageScreenshotRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides how one page is read.
 *
 * <ol>
 *   <li>Native text layer, always.
 *   <li>With image OCR disabled, nothing else.
 *   <li>If the page draws images, OCR the largest ones, one vision call each.
 *   <li>If it draws none and its text is sparse, the page is probably scanned: render it and OCR
 *       the screenshot. A successful OCR replaces the native text.
 *   <li>Otherwise the native text alone, without vision calls.
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageProcessor {

  private final PageTextExtractor pageTextExtractor;
  private final EmbeddedImageExtractor imageExtractor;
  private final VisionOcrService visionOcrService;
  private final PageScreenshotRenderer screenshotRenderer;
  private final ExtractionConfig config;

  public PageResult processPage(
      ExtractionSession session, int pageNumber, ExtractionOptions options) {
    String nativeText = pageTextExtractor.extractPageText(session, pageNumber);
    if (!options.extractImageText()) {
      return PageResult.textOnly(pageNumber, nativeText);
    }

    List<SelectedImage> images =
        imageExtractor.selectLargestImages(session, pageNumber, options.maxImagesPerPage());
    if (!images.isEmpty()) {
      return withImageTexts(session, pageNumber, nativeText, images);
    }

    if (isLikelyScanned(nativeText)) {
      return withScreenshotText(session, pageNumber, nativeText);
    }
    return PageResult.textOnly(pageNumber, nativeText);
  }

  boolean isLikelyScanned(String nativeText) {
    return nativeText.trim().length() < config.getOcr().getScannedPageThreshold();
  }

  private PageResult withImageTexts(
      ExtractionSession session, int pageNumber, String nativeText, List<SelectedImage> images) {
    List<String> imageTexts = new ArrayList<>();
    int calls = 0;
    for (SelectedImage image : images) {
      session.recordVisionCall();
      calls++;
      visionOcrService
          .extractTextFromImage(image.data(), image.mimeType())
          .ifPresent(imageTexts::add);
    }
    log.debug("Page {}: {} of {} images yielded text", pageNumber, imageTexts.size(), calls);
    return new PageResult(pageNumber, nativeText, imageTexts, calls);
  }

  private PageResult withScreenshotText(
      ExtractionSession session, int pageNumber, String nativeText) {
    Optional<byte[]> screenshot = screenshotRenderer.renderPage(session, pageNumber);
    if (screenshot.isEmpty()) {
      return PageResult.textOnly(pageNumber, nativeText);
    }
    log.debug("Page {} looks scanned ({} chars), running OCR on screenshot",
        pageNumber, nativeText.trim().length());
    session.recordVisionCall();
    Optional<String> ocrText =
        visionOcrService.extractTextFromImage(screenshot.get(), PageScreenshotRenderer.MIME_TYPE);
    return new PageResult(pageNumber, ocrText.orElse(nativeText), List.of(), 1);
  }
}
