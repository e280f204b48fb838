package com.flamingo.ai.docextract.support;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDFormContentStream;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;

/** Builds small PDFs in memory for tests. */
public final class TestPdfs {

  private final List<PageSpec> pages = new ArrayList<>();

  private TestPdfs() {}

  public static TestPdfs builder() {
    return new TestPdfs();
  }

  /** Convenience for a document of text-only pages. */
  public static byte[] textPages(String... pageTexts) {
    TestPdfs builder = builder();
    for (String text : pageTexts) {
      builder.page(text);
    }
    return builder.build();
  }

  public TestPdfs page(String text) {
    pages.add(new PageSpec(text, List.of(), false, false));
    return this;
  }

  /** A page with text and one image per {@code {width, height}} pair. */
  public TestPdfs pageWithImages(String text, int[]... sizes) {
    pages.add(new PageSpec(text, List.of(sizes), false, false));
    return this;
  }

  /** A page that paints the same image object twice. */
  public TestPdfs pageWithRepeatedImage(String text, int width, int height) {
    pages.add(new PageSpec(text, List.of(new int[] {width, height}), true, false));
    return this;
  }

  /** A page whose only image is painted inside a form XObject. */
  public TestPdfs pageWithImageInForm(String text, int width, int height) {
    pages.add(new PageSpec(text, List.of(new int[] {width, height}), false, true));
    return this;
  }

  public byte[] build() {
    try (PDDocument document = new PDDocument()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (PageSpec spec : pages) {
        PDPage page = new PDPage(PDRectangle.LETTER);
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          writeText(content, font, spec.text());
          float y = 80;
          for (int[] size : spec.images()) {
            PDImageXObject image =
                LosslessFactory.createFromImage(document, image(size[0], size[1]));
            if (spec.insideForm()) {
              PDFormXObject form = new PDFormXObject(document);
              form.setBBox(new PDRectangle(200, 200));
              form.setResources(new PDResources());
              try (PDFormContentStream formContent = new PDFormContentStream(form)) {
                formContent.drawImage(image, 0, 0, 100, 100);
              }
              content.saveGraphicsState();
              content.transform(Matrix.getTranslateInstance(50, y));
              content.drawForm(form);
              content.restoreGraphicsState();
            } else {
              content.drawImage(image, 50, y, 100, 100);
              if (spec.repeatImage()) {
                content.drawImage(image, 200, y, 100, 100);
              }
            }
            y += 110;
          }
        }
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static void writeText(PDPageContentStream content, PDType1Font font, String text)
      throws IOException {
    if (text == null || text.isEmpty()) {
      return;
    }
    content.beginText();
    content.setFont(font, 10);
    content.newLineAtOffset(40, 740);
    boolean first = true;
    for (String line : text.split("\n")) {
      if (!first) {
        content.newLineAtOffset(0, -14);
      }
      content.showText(line);
      first = false;
    }
    content.endText();
  }

  private static BufferedImage image(int width, int height) {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = image.createGraphics();
    graphics.setColor(Color.WHITE);
    graphics.fillRect(0, 0, width, height);
    graphics.setColor(Color.BLACK);
    graphics.drawLine(0, 0, width - 1, height - 1);
    graphics.dispose();
    return image;
  }

  private record PageSpec(
      String text, List<int[]> images, boolean repeatImage, boolean insideForm) {}
}
