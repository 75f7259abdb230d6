package com.scholary.sorter.decision;

/** No job has ever been recorded for the folder. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String folderPath) {
    super("No job for folder: " + folderPath);
  }
}
