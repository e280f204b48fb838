package com.flamingo.ai.docextract.exception;

/** Exception thrown when a document cannot be turned into usable text. */
public class DocumentProcessingException extends RuntimeException {

  private static final String DEFAULT_USER_MESSAGE = "Failed to process document";

  private final String documentId;
  private final String userMessage;

  public DocumentProcessingException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = DEFAULT_USER_MESSAGE;
  }

  public DocumentProcessingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = DEFAULT_USER_MESSAGE;
  }

  public DocumentProcessingException(String documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
