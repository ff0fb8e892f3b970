package io.b2mash.orghierarchy.importer;

import io.b2mash.orghierarchy.organization.DataSource;
import io.b2mash.orghierarchy.organization.Organization;
import io.b2mash.orghierarchy.organization.OrganizationClass;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Mutable state of one import run: the data source, classification and organization caches, the
 * raw record index used by {@code org_id} lookups, the set of organizations whose import is in
 * progress, and run statistics.
 *
 * <p>Cache writes made while a record is being imported are journaled. If that record's
 * transaction rolls back, {@link #rollbackRecord()} evicts them so the caches never refer to rows
 * that were not committed.
 */
final class ImportSession {

  private final Map<String, DataSource> dataSources = new HashMap<>();
  private final Map<String, OrganizationClass> classifications = new HashMap<>();
  // an empty Optional marks an organization skipped in this run
  private final Map<String, Optional<Organization>> organizations = new HashMap<>();
  private final Set<String> inProgress = new HashSet<>();
  private final Map<String, Map<String, Object>> recordsById = new HashMap<>();
  private final Deque<Runnable> journal = new ArrayDeque<>();
  private final String recordIdKey;
  private final Supplier<Iterator<Object>> fullWalk;
  private boolean indexComplete;
  private int created;
  private int updated;
  private int skipped;
  private int journalCreated;
  private int journalUpdated;
  private int journalSkipped;

  /**
   * @param recordIdKey raw record key used for the record index
   * @param fullWalk re-reads every record of the endpoint; used once, when an {@code org_id}
   *     lookup misses the records seen so far
   */
  ImportSession(String recordIdKey, Supplier<Iterator<Object>> fullWalk) {
    this.recordIdKey = recordIdKey;
    this.fullWalk = fullWalk;
  }

  static String organizationKey(DataSource dataSource, String originId) {
    return dataSource.getId() + ":" + originId.toLowerCase(Locale.ROOT);
  }

  // Data sources

  Optional<DataSource> cachedDataSource(String id) {
    return Optional.ofNullable(dataSources.get(id));
  }

  void cacheDataSource(DataSource dataSource) {
    String id = dataSource.getId();
    dataSources.put(id, dataSource);
    journal.push(() -> dataSources.remove(id));
  }

  // Classifications

  Optional<OrganizationClass> cachedClassification(String id) {
    return Optional.ofNullable(classifications.get(id));
  }

  void cacheClassification(OrganizationClass classification) {
    String id = classification.getId();
    classifications.put(id, classification);
    journal.push(() -> classifications.remove(id));
  }

  // Organizations

  boolean isProcessed(String key) {
    return organizations.containsKey(key);
  }

  /** The organization imported under {@code key}, empty if it was skipped or not yet processed. */
  Optional<Organization> processedOrganization(String key) {
    return organizations.getOrDefault(key, Optional.empty());
  }

  boolean isInProgress(String key) {
    return inProgress.contains(key);
  }

  void startOrganization(String key) {
    inProgress.add(key);
  }

  void finishOrganization(String key) {
    inProgress.remove(key);
  }

  void organizationCreated(String key, Organization organization) {
    cacheOrganization(key, Optional.of(organization));
    created++;
  }

  void organizationUpdated(String key, Organization organization) {
    cacheOrganization(key, Optional.of(organization));
    updated++;
  }

  void organizationSkipped(String key) {
    cacheOrganization(key, Optional.empty());
    skipped++;
  }

  /** Caches an organization that this run neither created nor updated. */
  void rememberOrganization(String key, Organization organization) {
    cacheOrganization(key, Optional.of(organization));
  }

  private void cacheOrganization(String key, Optional<Organization> result) {
    organizations.put(key, result);
    journal.push(() -> organizations.remove(key));
  }

  // Record index

  void indexRecord(Object record) {
    if (record instanceof Map<?, ?> map) {
      Object id = map.get(recordIdKey);
      if (id != null) {
        @SuppressWarnings("unchecked")
        Map<String, Object> raw = (Map<String, Object>) map;
        recordsById.putIfAbsent(id.toString(), raw);
      }
    }
  }

  Optional<Map<String, Object>> findRecord(String id) {
    Map<String, Object> record = recordsById.get(id);
    if (record == null && !indexComplete) {
      indexComplete = true;
      fullWalk.get().forEachRemaining(this::indexRecord);
      record = recordsById.get(id);
    }
    return Optional.ofNullable(record);
  }

  // Record boundaries

  void beginRecord() {
    journal.clear();
    journalCreated = created;
    journalUpdated = updated;
    journalSkipped = skipped;
  }

  void commitRecord() {
    journal.clear();
  }

  void rollbackRecord() {
    while (!journal.isEmpty()) {
      journal.pop().run();
    }
    inProgress.clear();
    created = journalCreated;
    updated = journalUpdated;
    skipped = journalSkipped;
  }

  ImportStatistics statistics() {
    return new ImportStatistics(created, updated, skipped);
  }
}
