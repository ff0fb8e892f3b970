package io.b2mash.orghierarchy.importer;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Organization attributes an import configuration may populate. */
enum OrganizationField {
  ORIGIN_ID("origin_id"),
  DATA_SOURCE("data_source"),
  NAME("name"),
  CLASSIFICATION("classification"),
  FOUNDING_DATE("founding_date"),
  DISSOLUTION_DATE("dissolution_date"),
  PARENT("parent"),
  INTERNAL_TYPE("internal_type"),
  ABBREVIATION("abbreviation");

  private final String fieldName;

  OrganizationField(String fieldName) {
    this.fieldName = fieldName;
  }

  String fieldName() {
    return fieldName;
  }

  static Optional<OrganizationField> fromFieldName(String fieldName) {
    return Arrays.stream(values()).filter(f -> f.fieldName.equals(fieldName)).findFirst();
  }

  static Set<String> fieldNames() {
    return Arrays.stream(values()).map(OrganizationField::fieldName).collect(Collectors.toSet());
  }
}
