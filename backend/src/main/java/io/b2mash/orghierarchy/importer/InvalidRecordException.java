package io.b2mash.orghierarchy.importer;

public class InvalidRecordException extends DataImportException {

  public InvalidRecordException(String message) {
    super(message);
  }
}
