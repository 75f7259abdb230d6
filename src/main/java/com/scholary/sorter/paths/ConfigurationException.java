package com.scholary.sorter.paths;

/** A source/target root was rejected; the active configuration is unchanged. */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
