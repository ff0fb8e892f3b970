package io.b2mash.orghierarchy.organization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import org.springframework.data.domain.Persistable;

/** An organization category such as "committee", namespaced by its data source. */
@Entity
@Table(name = "organization_classes")
public class OrganizationClass implements Persistable<String> {

  @Id
  @Column(name = "id", nullable = false, updatable = false, length = 255)
  private String id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "data_source_id")
  private DataSource dataSource;

  @Column(name = "origin_id", nullable = false, length = 255)
  private String originId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Transient private boolean persisted;

  protected OrganizationClass() {}

  public OrganizationClass(DataSource dataSource, String originId, String name) {
    this.dataSource = dataSource;
    this.originId = originId;
    this.id = CompositeId.of(dataSource, originId);
    this.name = name != null ? name : this.id;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PostLoad
  @PostPersist
  void markPersisted() {
    this.persisted = true;
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

  public String getOriginId() {
    return originId;
  }

  public String getName() {
    return name;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  @Override
  public String toString() {
    return name;
  }
}
