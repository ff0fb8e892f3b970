package io.b2mash.orghierarchy.importer;

/** A configured regex pattern did not match the source value. */
public class FieldPatternException extends DataImportException {

  public FieldPatternException(String value, String pattern) {
    super("Cannot extract value from string " + value + " with pattern " + pattern);
  }
}
