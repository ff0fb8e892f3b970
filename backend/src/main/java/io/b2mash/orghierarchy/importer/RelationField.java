package io.b2mash.orghierarchy.importer;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fields whose resolved values are imported as related entities instead of being assigned as
 * plain values.
 */
enum RelationField {
  DATA_SOURCE("data_source") {
    @Override
    Object importValue(RelatedEntityImporter importer, Object value) {
      return importer.importDataSource(value);
    }
  },
  CLASSIFICATION("classification") {
    @Override
    Object importValue(RelatedEntityImporter importer, Object value) {
      return importer.importClassification(value);
    }
  },
  PARENT("parent") {
    @Override
    Object importValue(RelatedEntityImporter importer, Object value) {
      return importer.importParent(value).orElse(null);
    }
  };

  private final String fieldName;

  RelationField(String fieldName) {
    this.fieldName = fieldName;
  }

  abstract Object importValue(RelatedEntityImporter importer, Object value);

  static Optional<RelationField> fromFieldName(String fieldName) {
    return Arrays.stream(values()).filter(f -> f.fieldName.equals(fieldName)).findFirst();
  }
}
