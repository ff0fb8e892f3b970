package io.b2mash.orghierarchy.organization;

import java.util.List;
import java.util.Optional;

/**
 * Storage for the organization hierarchy. Every {@link #save(Organization)} keeps the tree
 * consistent: the node's materialized path follows its parent, and among siblings affiliated
 * organizations precede normal ones.
 */
public interface OrganizationStore {

  /** Returns the data source with the given id, creating it if it does not exist. */
  DataSource getOrCreateDataSource(String id, String name);

  /**
   * Returns the organization class {@code "{dataSource}:{originId}"}, creating it if it does not
   * exist. Existing classes are never updated.
   */
  OrganizationClass getOrCreateClassification(DataSource dataSource, String originId, String name);

  /** Finds an organization by origin id (case-insensitively) within a data source. */
  Optional<Organization> findOrganization(DataSource dataSource, String originId);

  Optional<Organization> findById(String id);

  /**
   * Inserts or updates the organization and repositions it in the tree when its parent or internal
   * type changed.
   *
   * @throws io.b2mash.orghierarchy.exception.InvalidStateException if the new parent is the
   *     organization itself or one of its descendants
   */
  Organization save(Organization organization);

  /** Children in sibling order; root organizations when {@code organization} is null. */
  List<Organization> getChildren(Organization organization);

  /** All descendants, depth-first and in sibling order. */
  List<Organization> getDescendants(Organization organization);

  /** Ancestors from the root down to the direct parent. */
  List<Organization> getAncestors(Organization organization);

  /** Records that {@code organization} is replaced by {@code replacement} (null clears it). */
  Organization replace(Organization organization, Organization replacement);
}
