package io.b2mash.orghierarchy.importer;

/**
 * A parent reference led back to an organization whose import has not finished yet, i.e. the
 * source data contains a parent cycle.
 */
public class CircularReferenceException extends DataImportException {

  public CircularReferenceException(String organizationKey) {
    super("Circular parent reference detected at organization " + organizationKey);
  }
}
