package com.flamingo.ai.docextract.service.extraction.image;

import com.flamingo.ai.docextract.config.ExtractionConfig;
import com.flamingo.ai.docextract.service.extraction.ExtractionSession;
import com.flamingo.ai.docextract.service.extraction.model.SelectedImage;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Service;

/**
 * Finds the images drawn on a page and keeps the largest ones for OCR.
 *
 * <p>The page's content stream is walked with a {@link PDFStreamEngine} that intercepts the
 * {@code Do} operator, so only images that are actually painted count, including those nested in
 * form XObjects. Ranking uses the pixel size declared in the image dictionary; only the images that
 * survive ranking are decoded and re-encoded as PNG.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddedImageExtractor {

  private static final String PNG = "png";
  private static final String PNG_MIME_TYPE = "image/png";

  private final ExtractionConfig config;

  /**
   * Returns up to {@code maxImages} images of the page, largest pixel area first.
   *
   * @param session the extraction call
   * @param pageNumber 1-based page number
   * @param maxImages upper bound on returned images
   * @return selected images; empty when the page has none or they cannot be read
   */
  public List<SelectedImage> selectLargestImages(
      ExtractionSession session, int pageNumber, int maxImages) {
    if (maxImages <= 0) {
      return List.of();
    }
    try {
      return session.withDocument(document -> selectFromPage(document, pageNumber, maxImages));
    } catch (IOException | RuntimeException e) {
      log.warn("Image extraction failed for page {}: {}", pageNumber, e.getMessage());
      return List.of();
    }
  }

  private List<SelectedImage> selectFromPage(PDDocument document, int pageNumber, int maxImages)
      throws IOException {
    if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
      return List.of();
    }
    DrawnImageCollector collector = new DrawnImageCollector();
    collector.processPage(document.getPage(pageNumber - 1));

    List<PDImageXObject> drawn = collector.images();
    if (drawn.isEmpty()) {
      return List.of();
    }
    List<PDImageXObject> largest = largestFirst(drawn, maxImages);
    log.debug("Page {} draws {} images, keeping {}", pageNumber, drawn.size(), largest.size());

    List<SelectedImage> selected = new ArrayList<>(largest.size());
    for (PDImageXObject image : largest) {
      SelectedImage encoded = encode(image, pageNumber);
      if (encoded != null) {
        selected.add(encoded);
      }
    }
    return selected;
  }

  /** Orders by descending {@code width × height} and keeps the first {@code maxImages}. */
  static List<PDImageXObject> largestFirst(List<PDImageXObject> images, int maxImages) {
    return images.stream()
        .sorted(
            Comparator.comparingLong(
                    (PDImageXObject image) -> area(image.getWidth(), image.getHeight()))
                .reversed())
        .limit(Math.max(0, maxImages))
        .toList();
  }

  private static long area(int width, int height) {
    return (long) Math.max(0, width) * Math.max(0, height);
  }

  private SelectedImage encode(PDImageXObject image, int pageNumber) {
    try {
      BufferedImage bufferedImage = image.getImage();
      if (bufferedImage == null) {
        return null;
      }
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      if (!ImageIO.write(bufferedImage, PNG, baos)) {
        log.warn("No PNG writer available for image on page {}", pageNumber);
        return null;
      }
      byte[] data = baos.toByteArray();
      if (data.length > config.getOcr().getMaxImageBytes()) {
        log.warn("Skipping oversized image on page {} ({} bytes)", pageNumber, data.length);
        return null;
      }
      return new SelectedImage(
          bufferedImage.getWidth(), bufferedImage.getHeight(), data, PNG_MIME_TYPE);
    } catch (IOException | RuntimeException e) {
      log.warn("Could not decode image on page {}: {}", pageNumber, e.getMessage());
      return null;
    }
  }

  /** Records each image object painted by {@code Do}, descending into form XObjects. */
  private static final class DrawnImageCollector extends PDFStreamEngine {

    private final List<PDImageXObject> images = new ArrayList<>();
    private final Set<COSBase> seen = Collections.newSetFromMap(new IdentityHashMap<>());

    DrawnImageCollector() {
      addOperator(new DrawObject(this));
    }

    List<PDImageXObject> images() {
      return images;
    }

    void record(PDImageXObject image) {
      if (seen.add(image.getCOSObject())) {
        images.add(image);
      }
    }

    private static final class DrawObject extends OperatorProcessor {

      private final DrawnImageCollector collector;

      DrawObject(DrawnImageCollector collector) {
        super(collector);
        this.collector = collector;
      }

      @Override
      public void process(Operator operator, List<COSBase> operands) throws IOException {
        if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
          return;
        }
        PDResources resources = collector.getResources();
        if (resources == null) {
          return;
        }
        PDXObject xObject = resources.getXObject(objectName);
        if (xObject instanceof PDImageXObject image) {
          collector.record(image);
        } else if (xObject instanceof PDFormXObject form) {
          collector.showForm(form);
        }
      }

      @Override
      public String getName() {
        return OperatorName.DRAW_OBJECT;
      }
    }
  }
}
