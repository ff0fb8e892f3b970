package io.b2mash.orghierarchy.organization;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationRepository extends JpaRepository<Organization, String> {

  /** Origin ids are matched case-insensitively; stored values keep their original case. */
  List<Organization> findByDataSourceIdAndOriginIdIgnoreCase(String dataSourceId, String originId);

  List<Organization> findByParentIdOrderBySiblingPositionAsc(String parentId);

  List<Organization> findByParentIsNullOrderBySiblingPositionAsc();

  List<Organization> findByTreePathStartingWithOrderByDepthAscSiblingPositionAsc(String prefix);

  boolean existsByReplacedById(String replacedById);
}
