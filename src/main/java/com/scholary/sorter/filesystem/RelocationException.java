package com.scholary.sorter.filesystem;

/**
 * Exception thrown when a folder cannot be relocated.
 *
 * <p>When this is thrown the source folder is still complete at its original location.
 */
public class RelocationException extends RuntimeException {

  public RelocationException(String message) {
    super(message);
  }

  public RelocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
