package io.b2mash.orghierarchy.organization;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationClassRepository extends JpaRepository<OrganizationClass, String> {
  List<OrganizationClass> findByDataSourceId(String dataSourceId);
}
