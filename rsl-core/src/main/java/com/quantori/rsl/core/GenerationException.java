package com.quantori.rsl.core;

/**
 * Failure of the generation run outside of the vocabulary: the stream pipeline did not complete or the table could
 * not be persisted.
 */
public class GenerationException extends RuntimeException {
  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
