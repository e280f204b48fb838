package com.flamingo.ai.docextract.exception;

/**
 * Exception thrown when the parse adapter cannot find any usable way to call the configured parser
 * library, or every way it tried failed.
 */
public class ParserIncompatibilityException extends DocumentProcessingException {

  public ParserIncompatibilityException(String message) {
    super(null, message);
  }

  public ParserIncompatibilityException(String message, Throwable cause) {
    super(null, message, cause);
  }
}
