package io.b2mash.orghierarchy.importer;

import io.b2mash.orghierarchy.organization.CompositeId;
import io.b2mash.orghierarchy.organization.DataSource;
import io.b2mash.orghierarchy.organization.Organization;
import io.b2mash.orghierarchy.organization.OrganizationClass;
import io.b2mash.orghierarchy.organization.OrganizationStore;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns resolved relation values into persisted entities. Data sources and classifications are
 * created on first reference and cached for the rest of the run; parents are imported through the
 * organization import itself.
 */
final class RelatedEntityImporter {

  private final OrganizationStore store;
  private final ImportConfiguration configuration;
  private final ImportSession session;
  private final Function<Map<String, Object>, Optional<Organization>> organizationImport;

  RelatedEntityImporter(
      OrganizationStore store,
      ImportConfiguration configuration,
      ImportSession session,
      Function<Map<String, Object>, Optional<Organization>> organizationImport) {
    this.store = store;
    this.configuration = configuration;
    this.session = session;
    this.organizationImport = organizationImport;
  }

  /**
   * Accepts a bare identifier or an object with an {@code id} and optional {@code name}. The rename
   * map is applied to the identifier before the cache and store are consulted.
   */
  DataSource importDataSource(Object value) {
    String identifier;
    String name = null;
    if (value instanceof Map<?, ?> data) {
      identifier = stringOrNull(data.get("id"));
      name = stringOrNull(data.get("name"));
    } else {
      identifier = stringOrNull(value);
    }
    if (identifier == null || identifier.isEmpty()) {
      throw new FieldMissingException("Data source has no id: " + value);
    }
    String id = configuration.renamedDataSource(identifier);
    Optional<DataSource> cached = session.cachedDataSource(id);
    if (cached.isPresent()) {
      return cached.get();
    }
    DataSource dataSource = store.getOrCreateDataSource(id, name);
    session.cacheDataSource(dataSource);
    return dataSource;
  }

  /**
   * Accepts a bare identifier or an object. For objects {@code origin_id} takes precedence over
   * {@code id}; {@code data_source} and {@code name} are optional. A {@code "source:origin"}
   * identifier supplies whichever of the two parts is not given explicitly; otherwise the default
   * data source is used.
   */
  OrganizationClass importClassification(Object value) {
    String identifier;
    Object dataSourceValue = null;
    String name = null;
    if (value instanceof Map<?, ?> data) {
      Object originIdValue = data.get("origin_id");
      identifier = stringOrNull(originIdValue != null ? originIdValue : data.get("id"));
      dataSourceValue = data.get("data_source");
      name = stringOrNull(data.get("name"));
    } else {
      identifier = stringOrNull(value);
    }
    if (identifier == null || identifier.isEmpty()) {
      throw new FieldMissingException("Organization class has no id: " + value);
    }

    String originId;
    int separator = identifier.indexOf(':');
    if (separator >= 0) {
      if (FieldValueResolver.isEmpty(dataSourceValue)) {
        dataSourceValue = identifier.substring(0, separator);
      }
      originId = identifier.substring(separator + 1);
    } else {
      originId = identifier;
    }
    if (FieldValueResolver.isEmpty(dataSourceValue)) {
      dataSourceValue = configuration.defaultDataSource();
    }

    DataSource dataSource = importDataSource(dataSourceValue);
    String id = CompositeId.of(dataSource, originId);
    Optional<OrganizationClass> cached = session.cachedClassification(id);
    if (cached.isPresent()) {
      return cached.get();
    }
    OrganizationClass classification = store.getOrCreateClassification(dataSource, originId, name);
    session.cacheClassification(classification);
    return classification;
  }

  /**
   * Imports the parent organization. A bare identifier stands for a record holding only that
   * origin id; the organization is created with whatever the configuration can resolve from it
   * unless it already exists.
   */
  Optional<Organization> importParent(Object value) {
    if (value instanceof Map<?, ?> data) {
      @SuppressWarnings("unchecked")
      Map<String, Object> record = (Map<String, Object>) data;
      return organizationImport.apply(record);
    }
    if (value instanceof String || value instanceof Number) {
      String originIdField =
          configuration
              .fieldConfigFor(OrganizationField.ORIGIN_ID.fieldName())
              .sourceFieldOr(OrganizationField.ORIGIN_ID.fieldName());
      var record = new HashMap<String, Object>();
      record.put(originIdField, value);
      return organizationImport.apply(record);
    }
    throw new FieldValueException(OrganizationField.PARENT.fieldName(), value);
  }

  private static String stringOrNull(Object value) {
    return value != null ? value.toString() : null;
  }
}
