package com.quantori.rsl.api;

/**
 * Signals that the vocabulary is inconsistent, i.e. a required token is missing from the configuration or a tag
 * references a substituent code that is absent from the catalog. This is a programmer or data error and is never
 * recovered from.
 */
public class VocabularyException extends RuntimeException {
  /**
   * Constructs a {@code VocabularyException} with the specified detail message.
   *
   * @param message the detail message, or null
   */
  public VocabularyException(String message) {
    super(message);
  }

  /**
   * Constructs a {@code VocabularyException} with the specified detail message and cause.
   *
   * @param message the detail message, or null
   * @param cause   the cause
   */
  public VocabularyException(String message, Throwable cause) {
    super(message, cause);
  }
}
