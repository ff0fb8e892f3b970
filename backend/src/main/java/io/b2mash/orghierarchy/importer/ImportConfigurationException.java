package io.b2mash.orghierarchy.importer;

/**
 * The import configuration is unusable: unknown preset or data type, missing regex pattern, or
 * fields that cannot be imported.
 */
public class ImportConfigurationException extends DataImportException {

  public ImportConfigurationException(String message) {
    super(message);
  }

  public ImportConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
