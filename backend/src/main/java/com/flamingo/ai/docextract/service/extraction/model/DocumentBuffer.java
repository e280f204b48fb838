package com.flamingo.ai.docextract.service.extraction.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Raw bytes of an uploaded document together with its declared MIME type.
 *
 * <p>The bytes are copied once on construction; {@link #bytes()} hands out the internal array
 * without copying so that multi-megabyte documents are not duplicated per page. Callers must treat
 * it as read-only. Two buffers are equal when their MIME types and contents are equal.
 *
 * @param bytes document content
 * @param mimeType declared MIME type, lower-cased (e.g. {@code application/pdf})
 */
public record DocumentBuffer(byte[] bytes, String mimeType) {

  public static final String PDF = "application/pdf";

  private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

  public DocumentBuffer {
    bytes = bytes == null ? new byte[0] : bytes.clone();
    mimeType = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
  }

  public static DocumentBuffer pdf(byte[] bytes) {
    return new DocumentBuffer(bytes, PDF);
  }

  public int size() {
    return bytes.length;
  }

  public boolean isEmpty() {
    return bytes.length == 0;
  }

  public boolean isPdf() {
    return PDF.equals(mimeType);
  }

  /** Returns {@code true} if the buffer starts with the {@code %PDF} file signature. */
  public boolean hasPdfSignature() {
    return bytes.length >= PDF_SIGNATURE.length
        && Arrays.equals(bytes, 0, PDF_SIGNATURE.length, PDF_SIGNATURE, 0, PDF_SIGNATURE.length);
  }

  /** First bytes of the buffer as printable text, for error messages. */
  public String headerPreview() {
    int len = Math.min(bytes.length, PDF_SIGNATURE.length);
    return new String(bytes, 0, len, StandardCharsets.ISO_8859_1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DocumentBuffer other
        && mimeType.equals(other.mimeType)
        && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * mimeType.hashCode() + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "DocumentBuffer[" + mimeType + ", " + bytes.length + " bytes]";
  }
}
