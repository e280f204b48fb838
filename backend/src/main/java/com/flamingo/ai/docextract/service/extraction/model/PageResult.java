package com.flamingo.ai.docextract.service.extraction.model;

import java.util.List;

/**
 * Outcome of processing one page.
 *
 * @param pageNumber 1-based physical page number
 * @param nativeText text layer of the page, or the OCR text of its screenshot for scanned pages
 * @param imageTexts OCR text of the selected embedded images, largest image first
 * @param visionCalls vision-model calls made for this page
 */
public record PageResult(
    int pageNumber, String nativeText, List<String> imageTexts, int visionCalls) {

  public PageResult {
    nativeText = nativeText == null ? "" : nativeText;
    imageTexts = imageTexts == null ? List.of() : List.copyOf(imageTexts);
  }

  public static PageResult empty(int pageNumber) {
    return new PageResult(pageNumber, "", List.of(), 0);
  }

  public static PageResult textOnly(int pageNumber, String text) {
    return new PageResult(pageNumber, text, List.of(), 0);
  }
}
