package io.b2mash.orghierarchy.importer;

public class FieldMissingException extends DataImportException {

  public FieldMissingException(String message) {
    super(message);
  }
}
