package io.b2mash.orghierarchy.importer;

/** Base class for failures while importing organization data from a REST source. */
public class DataImportException extends RuntimeException {

  public DataImportException(String message) {
    super(message);
  }

  public DataImportException(String message, Throwable cause) {
    super(message, cause);
  }
}
