package com.flamingo.ai.docextract.exception;

/** Exception thrown when a buffer is empty or does not carry the signature of its declared type. */
public class MalformedDocumentException extends DocumentProcessingException {

  public MalformedDocumentException(String message) {
    super(null, message, "The uploaded file is empty or is not a valid document of its type.");
  }
}
