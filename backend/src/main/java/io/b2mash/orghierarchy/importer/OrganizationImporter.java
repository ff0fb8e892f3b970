package io.b2mash.orghierarchy.importer;

import io.b2mash.orghierarchy.organization.DataSource;
import io.b2mash.orghierarchy.organization.InternalType;
import io.b2mash.orghierarchy.organization.Organization;
import io.b2mash.orghierarchy.organization.OrganizationClass;
import io.b2mash.orghierarchy.organization.OrganizationStore;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Imports organizations from one REST endpoint into an {@link OrganizationStore}.
 *
 * <p>An importer is one import run: its caches and statistics live as long as the instance. Each
 * top-level record is imported in its own transaction, together with every data source,
 * classification and parent organization it needed to create. Within a run the first import of an
 * organization wins; later references to the same organization are served from the cache.
 *
 * <p>Instances are not thread-safe. Use {@link OrganizationImporterFactory} to create one per run.
 */
public class OrganizationImporter {

  private static final Logger log = LoggerFactory.getLogger(OrganizationImporter.class);

  private final URI url;
  private final ImportConfiguration configuration;
  private final OrganizationStore store;
  private final TransactionOperations transactionOperations;
  private final PaginatedFetcher fetcher;
  private final ImportSession session;
  private final RelatedEntityImporter relatedEntityImporter;
  private final FieldValueResolver fieldValueResolver;
  private Organization defaultParent;
  private boolean defaultParentResolved;

  public OrganizationImporter(
      URI url,
      ImportConfiguration configuration,
      SourceClient sourceClient,
      OrganizationStore store,
      TransactionOperations transactionOperations) {
    this.url = url;
    this.configuration = configuration;
    this.store = store;
    this.transactionOperations = transactionOperations;
    this.fetcher = new PaginatedFetcher(sourceClient, configuration);
    this.session = new ImportSession(configuration.recordIdKey(), () -> fetcher.iterate(url));
    this.relatedEntityImporter =
        new RelatedEntityImporter(store, configuration, session, this::importOrganization);
    this.fieldValueResolver =
        new FieldValueResolver(sourceClient, url, session, relatedEntityImporter);
    log.info(
        "Importing organization data from {} with the following configuration: {}",
        url,
        configuration);
  }

  /**
   * Imports every record the endpoint yields, page by page.
   *
   * @throws DataImportException on the first record that fails; records imported before it stay
   *     committed
   */
  public ImportStatistics importAll() {
    ensureDefaultParent();
    Iterator<Object> records = fetcher.iterate(url);
    while (records.hasNext()) {
      Object record = records.next();
      session.indexRecord(record);
      importOne(record);
    }
    ImportStatistics statistics = session.statistics();
    log.info(
        "Import from {} completed: {} created, {} updated, {} skipped",
        url,
        statistics.created(),
        statistics.updated(),
        statistics.skipped());
    return statistics;
  }

  /**
   * Imports a single raw record in its own transaction.
   *
   * @return the created or updated organization, or empty if the record was skipped
   * @throws InvalidRecordException if the record is not a JSON object
   */
  public Optional<Organization> importOne(Object record) {
    ensureDefaultParent();
    return inRecordTransaction(() -> importOrganization(record));
  }

  public ImportStatistics statistics() {
    return session.statistics();
  }

  public ImportConfiguration getConfiguration() {
    return configuration;
  }

  public URI getUrl() {
    return url;
  }

  private <T> T inRecordTransaction(Supplier<T> work) {
    session.beginRecord();
    try {
      T result = transactionOperations.execute(status -> work.get());
      session.commitRecord();
      return result;
    } catch (RuntimeException e) {
      session.rollbackRecord();
      throw e;
    }
  }

  private void ensureDefaultParent() {
    if (defaultParentResolved || !configuration.hasDefaultParent()) {
      return;
    }
    defaultParent = inRecordTransaction(this::findOrCreateDefaultParent);
    defaultParentResolved = true;
  }

  private Organization findOrCreateDefaultParent() {
    String originId = configuration.defaultDataSource();
    DataSource dataSource = relatedEntityImporter.importDataSource(originId);
    String key = ImportSession.organizationKey(dataSource, originId);
    Optional<Organization> existing = store.findOrganization(dataSource, originId);
    if (existing.isPresent()) {
      session.rememberOrganization(key, existing.get());
      return existing.get();
    }
    Organization created =
        store.save(
            new Organization(dataSource, originId, configuration.defaultParentOrganization()));
    log.info("Created default parent organization {}", created.getId());
    session.organizationCreated(key, created);
    return created;
  }

  /** Imports one organization record, recursing into its parent. Runs inside a transaction. */
  private Optional<Organization> importOrganization(Object record) {
    if (!(record instanceof Map<?, ?> map)) {
      throw new InvalidRecordException("Organization data must be an object, got: " + record);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> data = (Map<String, Object>) map;

    String originId = resolveOriginId(data);
    DataSource dataSource = resolveDataSource(data);
    String key = ImportSession.organizationKey(dataSource, originId);
    if (session.isProcessed(key)) {
      return session.processedOrganization(key);
    }
    if (session.isInProgress(key)) {
      throw new CircularReferenceException(key);
    }

    session.startOrganization(key);
    try {
      Optional<Organization> existing = store.findOrganization(dataSource, originId);
      if (existing.isPresent()) {
        return Optional.of(update(key, existing.get(), data));
      }
      return create(key, dataSource, originId, data);
    } finally {
      session.finishOrganization(key);
    }
  }

  private String resolveOriginId(Map<String, Object> data) {
    String field = OrganizationField.ORIGIN_ID.fieldName();
    Object originId = fieldValueResolver.resolve(data, field, configuration.fieldConfigFor(field));
    if (FieldValueResolver.isEmpty(originId)) {
      throw new FieldMissingException("Organization has no origin id: " + data);
    }
    return originId.toString();
  }

  /**
   * The record's data source. Without a data_source field config the field is optional; a missing
   * or empty value falls back to the default data source.
   */
  private DataSource resolveDataSource(Map<String, Object> data) {
    String field = OrganizationField.DATA_SOURCE.fieldName();
    FieldConfig config = configuration.fieldConfigFor(field);
    boolean optional = !configuration.hasFieldConfig(field) || config.optional();
    Object value = null;
    try {
      value = fieldValueResolver.resolve(data, field, config);
    } catch (ImportConfigurationException | CircularReferenceException e) {
      throw e;
    } catch (DataImportException e) {
      if (!optional) {
        throw e;
      }
    }
    if (value instanceof DataSource dataSource) {
      return dataSource;
    }
    return relatedEntityImporter.importDataSource(configuration.defaultDataSource());
  }

  private Organization update(String key, Organization organization, Map<String, Object> data) {
    Map<OrganizationField, Object> values = resolveFields(key, data, configuration.updateFields());
    values.forEach((field, value) -> apply(organization, field, value));
    assignDefaultParent(organization);
    Organization saved = store.save(organization);
    log.info("Organization already exists, updated: {}", saved.getId());
    session.organizationUpdated(key, saved);
    return saved;
  }

  private Optional<Organization> create(
      String key, DataSource dataSource, String originId, Map<String, Object> data) {
    List<String> fields = new ArrayList<>(configuration.fields());
    var values = new LinkedHashMap<OrganizationField, Object>();
    // classification first, so skipped organizations do not pull in their parents
    if (fields.remove(OrganizationField.CLASSIFICATION.fieldName())) {
      values.putAll(
          resolveFields(key, data, List.of(OrganizationField.CLASSIFICATION.fieldName())));
      if (values.get(OrganizationField.CLASSIFICATION) instanceof OrganizationClass classification
          && configuration.skipsClassification(classification.getOriginId())) {
        log.info("Skipping organization {} with classification {}", key, classification.getId());
        session.organizationSkipped(key);
        return Optional.empty();
      }
    }
    values.putAll(resolveFields(key, data, fields));

    var organization = new Organization(dataSource, originId, null);
    values.forEach((field, value) -> apply(organization, field, value));
    assignDefaultParent(organization);
    Organization saved = store.save(organization);
    log.info("Created organization {}", saved.getId());
    session.organizationCreated(key, saved);
    return Optional.of(saved);
  }

  /**
   * Resolves the given fields in order. Identity fields are skipped; they are resolved once per
   * record and never reassigned. Optional fields that fail to resolve are left out.
   */
  private Map<OrganizationField, Object> resolveFields(
      String key, Map<String, Object> data, List<String> fieldNames) {
    var values = new LinkedHashMap<OrganizationField, Object>();
    for (String fieldName : fieldNames) {
      OrganizationField field =
          OrganizationField.fromFieldName(fieldName)
              .orElseThrow(() -> new ImportConfigurationException("Unknown field: " + fieldName));
      if (field == OrganizationField.ORIGIN_ID || field == OrganizationField.DATA_SOURCE) {
        continue;
      }
      FieldConfig config = configuration.fieldConfigFor(fieldName);
      try {
        values.put(field, fieldValueResolver.resolve(data, fieldName, config));
      } catch (ImportConfigurationException | CircularReferenceException e) {
        throw e;
      } catch (DataImportException e) {
        if (!config.optional()) {
          throw e;
        }
        log.warn(
            "Skipping optional field {} of organization {}: {}", fieldName, key, e.getMessage());
      }
    }
    return values;
  }

  private static void apply(Organization organization, OrganizationField field, Object value) {
    switch (field) {
      case NAME -> organization.setName(value != null ? value.toString() : "");
      case ABBREVIATION -> organization.setAbbreviation(abbreviation(value));
      case CLASSIFICATION ->
          organization.setClassification(entity(field, value, OrganizationClass.class));
      case PARENT -> organization.setParent(entity(field, value, Organization.class));
      case FOUNDING_DATE -> organization.setFoundingDate(parseDate(field.fieldName(), value));
      case DISSOLUTION_DATE ->
          organization.setDissolutionDate(parseDate(field.fieldName(), value));
      case INTERNAL_TYPE -> organization.setInternalType(internalType(value));
      case ORIGIN_ID, DATA_SOURCE -> {
        // identity, resolved before the field loop
      }
    }
  }

  private void assignDefaultParent(Organization organization) {
    if (defaultParent != null
        && organization.getParent() == null
        && !defaultParent.getId().equals(organization.getId())) {
      organization.setParent(defaultParent);
    }
  }

  private static <T> T entity(OrganizationField field, Object value, Class<T> type) {
    if (FieldValueResolver.isEmpty(value)) {
      return null;
    }
    if (!type.isInstance(value)) {
      throw new FieldValueException(field.fieldName(), value);
    }
    return type.cast(value);
  }

  private static String abbreviation(Object value) {
    if (FieldValueResolver.isEmpty(value)) {
      return null;
    }
    String abbreviation = value.toString();
    if (abbreviation.length() > 50) {
      throw new FieldValueException(OrganizationField.ABBREVIATION.fieldName(), value);
    }
    return abbreviation;
  }

  private static InternalType internalType(Object value) {
    if (FieldValueResolver.isEmpty(value)) {
      return InternalType.NORMAL;
    }
    try {
      return InternalType.fromValue(value.toString());
    } catch (IllegalArgumentException e) {
      throw new FieldValueException(OrganizationField.INTERNAL_TYPE.fieldName(), value, e);
    }
  }

  /** Accepts {@code yyyy-MM-dd} or an ISO date-time, whose date part is kept. */
  static LocalDate parseDate(String field, Object value) {
    if (FieldValueResolver.isEmpty(value)) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new FieldValueException(field, value);
    }
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException e) {
      try {
        return DateTimeFormatter.ISO_DATE_TIME.parse(text, LocalDate::from);
      } catch (DateTimeParseException dateTimeFailure) {
        throw new FieldValueException(field, value, dateTimeFailure);
      }
    }
  }
}
