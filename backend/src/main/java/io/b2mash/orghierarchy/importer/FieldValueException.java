package io.b2mash.orghierarchy.importer;

/** A resolved value cannot be converted to the type of the organization attribute. */
public class FieldValueException extends DataImportException {

  public FieldValueException(String field, Object value) {
    super("Invalid value for field " + field + ": " + value);
  }

  public FieldValueException(String field, Object value, Throwable cause) {
    super("Invalid value for field " + field + ": " + value, cause);
  }
}
