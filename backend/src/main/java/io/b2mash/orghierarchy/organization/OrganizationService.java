package io.b2mash.orghierarchy.organization;

import io.b2mash.orghierarchy.exception.InvalidStateException;
import io.b2mash.orghierarchy.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** JPA-backed {@link OrganizationStore} using a materialized path plus sibling positions. */
@Service
public class OrganizationService implements OrganizationStore {

  private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

  private final OrganizationRepository organizationRepository;
  private final OrganizationClassRepository organizationClassRepository;
  private final DataSourceRepository dataSourceRepository;
  private final TreeOrdering.Nodes repositoryNodes = new RepositoryNodes();

  public OrganizationService(
      OrganizationRepository organizationRepository,
      OrganizationClassRepository organizationClassRepository,
      DataSourceRepository dataSourceRepository) {
    this.organizationRepository = organizationRepository;
    this.organizationClassRepository = organizationClassRepository;
    this.dataSourceRepository = dataSourceRepository;
  }

  @Override
  @Transactional
  public DataSource getOrCreateDataSource(String id, String name) {
    return dataSourceRepository
        .findById(id)
        .orElseGet(
            () -> {
              log.info("Creating data source {}", id);
              return dataSourceRepository.save(new DataSource(id, name));
            });
  }

  @Override
  @Transactional
  public OrganizationClass getOrCreateClassification(
      DataSource dataSource, String originId, String name) {
    String id = CompositeId.of(dataSource, originId);
    return organizationClassRepository
        .findById(id)
        .orElseGet(
            () -> {
              log.info("Creating organization class {}", id);
              return organizationClassRepository.save(
                  new OrganizationClass(dataSource, originId, name));
            });
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Organization> findOrganization(DataSource dataSource, String originId) {
    return organizationRepository
        .findByDataSourceIdAndOriginIdIgnoreCase(dataSource.getId(), originId)
        .stream()
        .findFirst();
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Organization> findById(String id) {
    return organizationRepository.findById(id);
  }

  @Override
  @Transactional
  public Organization save(Organization organization) {
    return TreeOrdering.save(organization, repositoryNodes);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Organization> getChildren(Organization organization) {
    if (organization == null) {
      return organizationRepository.findByParentIsNullOrderBySiblingPositionAsc();
    }
    return organizationRepository.findByParentIdOrderBySiblingPositionAsc(organization.getId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<Organization> getDescendants(Organization organization) {
    var managed = require(organization.getId());
    var candidates =
        organizationRepository.findByTreePathStartingWithOrderByDepthAscSiblingPositionAsc(
            managed.getTreePath());
    return TreeOrdering.depthFirst(managed, candidates);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Organization> getAncestors(Organization organization) {
    var ancestors = new ArrayList<Organization>();
    String parentId = require(organization.getId()).getParentId();
    while (parentId != null) {
      var ancestor = require(parentId);
      ancestors.add(ancestor);
      parentId = ancestor.getParentId();
    }
    Collections.reverse(ancestors);
    return ancestors;
  }

  @Override
  @Transactional
  public Organization replace(Organization organization, Organization replacement) {
    var managed = require(organization.getId());
    if (replacement == null) {
      managed.replaceWith(null);
      return organizationRepository.save(managed);
    }
    var managedReplacement = require(replacement.getId());
    if (organizationRepository.existsByReplacedById(managedReplacement.getId())) {
      throw new InvalidStateException(
          "Invalid replacement",
          "Organization " + managedReplacement.getId() + " already replaces another organization");
    }
    managed.replaceWith(managedReplacement);
    log.info("Organization {} replaced by {}", managed.getId(), managedReplacement.getId());
    return organizationRepository.save(managed);
  }

  private Organization require(String id) {
    return organizationRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Organization", id));
  }

  private final class RepositoryNodes implements TreeOrdering.Nodes {

    @Override
    public Optional<Organization> findById(String id) {
      return organizationRepository.findById(id);
    }

    @Override
    public Organization write(Organization organization) {
      return organizationRepository.save(organization);
    }

    @Override
    public List<Organization> children(Organization parent) {
      return getChildren(parent);
    }

    @Override
    public List<Organization> withPathPrefix(String prefix) {
      return organizationRepository.findByTreePathStartingWithOrderByDepthAscSiblingPositionAsc(
          prefix);
    }
  }
}
