package com.flamingo.ai.docextract.exception;

/** Exception thrown when no text extractor handles the declared MIME type. */
public class UnsupportedDocumentTypeException extends DocumentProcessingException {

  private final String mimeType;

  public UnsupportedDocumentTypeException(String mimeType) {
    super(null, "Unsupported file type: " + mimeType, "This file type is not supported.");
    this.mimeType = mimeType;
  }

  public String getMimeType() {
    return mimeType;
  }
}
