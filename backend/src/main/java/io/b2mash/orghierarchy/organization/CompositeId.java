package io.b2mash.orghierarchy.organization;

/**
 * Builds the {@code "{data_source}:{origin_id}"} identifier shared by organizations and
 * organization classes. The identifier is assigned once, when the entity is constructed.
 */
public final class CompositeId {

  private CompositeId() {}

  public static String of(DataSource dataSource, String originId) {
    return of(dataSource != null ? dataSource.getId() : null, originId);
  }

  public static String of(String dataSourceId, String originId) {
    return dataSourceId + ":" + originId;
  }
}
