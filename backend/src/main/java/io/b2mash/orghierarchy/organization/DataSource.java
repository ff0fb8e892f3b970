package io.b2mash.orghierarchy.organization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

/** The named origin system an organization or organization class was imported from. */
@Entity
@Table(name = "data_sources")
public class DataSource implements Persistable<String> {

  @Id
  @Column(name = "id", nullable = false, length = 100)
  private String id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "user_editable_organizations", nullable = false)
  private boolean userEditableOrganizations;

  @Transient private boolean persisted;

  protected DataSource() {}

  public DataSource(String id, String name) {
    this.id = id;
    this.name = name != null ? name : id;
    this.userEditableOrganizations = false;
  }

  public void allowUserEditing(boolean userEditableOrganizations) {
    this.userEditableOrganizations = userEditableOrganizations;
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

  public String getName() {
    return name;
  }

  public boolean isUserEditableOrganizations() {
    return userEditableOrganizations;
  }

  @Override
  public String toString() {
    return name;
  }
}
