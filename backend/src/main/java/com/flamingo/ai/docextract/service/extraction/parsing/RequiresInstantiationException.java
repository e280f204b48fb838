package com.flamingo.ai.docextract.service.extraction.parsing;

/**
 * Thrown by a {@link DirectParser} whose library cannot be invoked directly and must be
 * constructed instead.
 */
public class RequiresInstantiationException extends RuntimeException {

  public RequiresInstantiationException(String message) {
    super(message);
  }
}
