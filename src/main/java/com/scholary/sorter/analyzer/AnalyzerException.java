package com.scholary.sorter.analyzer;

/**
 * Exception thrown when the analyzer cannot produce a usable proposal.
 *
 * <p>This could be due to network issues, service unavailability, or malformed responses.
 */
public class AnalyzerException extends RuntimeException {

  public AnalyzerException(String message) {
    super(message);
  }

  public AnalyzerException(String message, Throwable cause) {
    super(message, cause);
  }
}
