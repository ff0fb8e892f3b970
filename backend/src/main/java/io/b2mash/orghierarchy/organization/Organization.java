package io.b2mash.orghierarchy.organization;

import io.b2mash.orghierarchy.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToOne;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import org.springframework.data.domain.Persistable;

/**
 * A node in the organization hierarchy. The identifier is {@code "{data_source}:{origin_id}"},
 * computed once at construction and never recomputed, even if the origin id or data source change
 * later.
 *
 * <p>Tree placement is stored as a materialized path ({@code treePath}, made of the encoded ids
 * from the root down to this node) and a position among siblings. Both are maintained by the
 * {@link OrganizationStore}; callers only set {@link #setParent(Organization)} and {@link
 * #setInternalType(InternalType)}.
 */
@Entity
@Table(name = "organizations")
public class Organization implements Persistable<String> {

  static final String PATH_SEPARATOR = "/";

  @Id
  @Column(name = "id", nullable = false, updatable = false, length = 255)
  private String id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "data_source_id")
  private DataSource dataSource;

  @Column(name = "origin_id", nullable = false, length = 255)
  private String originId;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "classification_id")
  private OrganizationClass classification;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "abbreviation", length = 50)
  private String abbreviation;

  @Column(name = "founding_date")
  private LocalDate foundingDate;

  @Column(name = "dissolution_date")
  private LocalDate dissolutionDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "internal_type", nullable = false, length = 20)
  private InternalType internalType;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "parent_id")
  private Organization parent;

  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "replaced_by_id")
  private Organization replacedBy;

  @Column(name = "tree_path", nullable = false, length = 4000)
  private String treePath;

  @Column(name = "depth", nullable = false)
  private int depth;

  @Column(name = "sibling_position", nullable = false)
  private int siblingPosition;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Transient private boolean persisted;

  // Parent and type the node was last placed with; a difference triggers a reposition on save.
  @Transient private boolean placed;
  @Transient private String placedParentId;
  @Transient private InternalType placedInternalType;

  protected Organization() {}

  public Organization(DataSource dataSource, String originId, String name) {
    this.dataSource = dataSource;
    this.originId = originId;
    this.id = CompositeId.of(dataSource, originId);
    this.name = name != null ? name : "";
    this.internalType = InternalType.NORMAL;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PostLoad
  void onLoad() {
    this.persisted = true;
    markPlaced();
  }

  @PostPersist
  void onPersist() {
    this.persisted = true;
  }

  /**
   * Sets the organization that replaces this one.
   *
   * @throws InvalidStateException if the replacement is this organization or has itself already
   *     been replaced
   */
  public void replaceWith(Organization replacement) {
    if (replacement == null) {
      this.replacedBy = null;
      this.updatedAt = Instant.now();
      return;
    }
    if (replacement.getId().equals(id)) {
      throw new InvalidStateException(
          "Invalid replacement", "Organization " + id + " cannot replace itself");
    }
    if (replacement.getReplacedBy() != null) {
      throw new InvalidStateException(
          "Invalid replacement",
          "Organization " + replacement.getId() + " has already been replaced");
    }
    this.replacedBy = replacement;
    this.updatedAt = Instant.now();
  }

  boolean needsPlacement() {
    return !placed
        || !Objects.equals(placedParentId, getParentId())
        || placedInternalType != internalType;
  }

  void markPlaced() {
    this.placed = true;
    this.placedParentId = getParentId();
    this.placedInternalType = internalType;
  }

  /** Swaps the parent reference for the store's own instance of the same organization. */
  void attachParent(Organization sameParent) {
    this.parent = sameParent;
  }

  /** Recomputes the materialized path below the given (already placed) parent. */
  void relocateUnder(Organization newParent) {
    String prefix = newParent != null ? newParent.getTreePath() : PATH_SEPARATOR;
    this.treePath = prefix + pathSegment(id) + PATH_SEPARATOR;
    this.depth = newParent != null ? newParent.getDepth() + 1 : 0;
  }

  /** Rewrites the path of a descendant after one of its ancestors moved. */
  void rebase(String oldPrefix, String newPrefix, int depthDelta) {
    this.treePath = newPrefix + treePath.substring(oldPrefix.length());
    this.depth = depth + depthDelta;
  }

  void moveToPosition(int siblingPosition) {
    this.siblingPosition = siblingPosition;
  }

  /** True if this node lies on the path from the root to {@code other}, excluding other itself. */
  public boolean isAncestorOf(Organization other) {
    return treePath != null
        && other.getTreePath() != null
        && !id.equals(other.getId())
        && other.getTreePath().startsWith(treePath);
  }

  static String pathSegment(String id) {
    return id.replace("%", "%25").replace(PATH_SEPARATOR, "%2F");
  }

  public String getParentId() {
    return parent != null ? parent.getId() : null;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public boolean isNew() {
    return !persisted;
  }

  public DataSource getDataSource() {
    return dataSource;
  }

  public void setDataSource(DataSource dataSource) {
    this.dataSource = dataSource;
    this.updatedAt = Instant.now();
  }

  public String getOriginId() {
    return originId;
  }

  public void setOriginId(String originId) {
    this.originId = originId;
    this.updatedAt = Instant.now();
  }

  public OrganizationClass getClassification() {
    return classification;
  }

  public void setClassification(OrganizationClass classification) {
    this.classification = classification;
    this.updatedAt = Instant.now();
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name != null ? name : "";
    this.updatedAt = Instant.now();
  }

  public String getAbbreviation() {
    return abbreviation;
  }

  public void setAbbreviation(String abbreviation) {
    this.abbreviation = abbreviation;
    this.updatedAt = Instant.now();
  }

  public LocalDate getFoundingDate() {
    return foundingDate;
  }

  public void setFoundingDate(LocalDate foundingDate) {
    this.foundingDate = foundingDate;
    this.updatedAt = Instant.now();
  }

  public LocalDate getDissolutionDate() {
    return dissolutionDate;
  }

  public void setDissolutionDate(LocalDate dissolutionDate) {
    this.dissolutionDate = dissolutionDate;
    this.updatedAt = Instant.now();
  }

  public InternalType getInternalType() {
    return internalType;
  }

  public void setInternalType(InternalType internalType) {
    this.internalType = internalType != null ? internalType : InternalType.NORMAL;
    this.updatedAt = Instant.now();
  }

  public Organization getParent() {
    return parent;
  }

  public void setParent(Organization parent) {
    this.parent = parent;
    this.updatedAt = Instant.now();
  }

  public Organization getReplacedBy() {
    return replacedBy;
  }

  public String getTreePath() {
    return treePath;
  }

  public int getDepth() {
    return depth;
  }

  public int getSiblingPosition() {
    return siblingPosition;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    if (dissolutionDate != null) {
      return name + " (dissolved)";
    }
    return name;
  }
}
