package io.b2mash.orghierarchy.importer;

/** An HTTP request for a page or a linked resource failed or returned unreadable JSON. */
public class FetchException extends DataImportException {

  public FetchException(String message) {
    super(message);
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
