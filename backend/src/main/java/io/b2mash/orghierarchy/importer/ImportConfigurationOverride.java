package io.b2mash.orghierarchy.importer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Caller-supplied changes to a preset. Only the keys that were given replace the preset's values,
 * and a key given as null replaces the preset's value with null. See {@link
 * ImportConfigurationResolver#merge} for how {@code field_config} is combined.
 */
public final class ImportConfigurationOverride {

  static final String NEXT_KEY = "next_key";
  static final String RESULTS_KEY = "results_key";
  static final String HAS_META = "has_meta";
  static final String META_KEY = "meta_key";
  static final String RECORD_ID_KEY = "record_id_key";
  static final String FIELDS = "fields";
  static final String UPDATE_FIELDS = "update_fields";
  static final String FIELD_CONFIG = "field_config";
  static final String RENAME_DATA_SOURCE = "rename_data_source";
  static final String DEFAULT_DATA_SOURCE = "default_data_source";
  static final String DEFAULT_PARENT_ORGANIZATION = "default_parent_organization";
  static final String SKIP_CLASSIFICATIONS = "skip_classifications";

  private final Set<String> givenKeys = new LinkedHashSet<>();
  private String nextKey;
  private String resultsKey;
  private Boolean hasMeta;
  private String metaKey;
  private String recordIdKey;
  private List<String> fields;
  private List<String> updateFields;
  private Map<String, FieldConfig> fieldConfig;
  private Map<String, String> renameDataSource;
  private String defaultDataSource;
  private String defaultParentOrganization;
  private List<String> skipClassifications;

  public ImportConfigurationOverride() {}

  public static ImportConfigurationOverride none() {
    return new ImportConfigurationOverride();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Whether the override carries {@code key}, possibly with a null value. */
  public boolean isGiven(String key) {
    return givenKeys.contains(key);
  }

  public Set<String> givenKeys() {
    return Collections.unmodifiableSet(givenKeys);
  }

  public String nextKey() {
    return nextKey;
  }

  @JsonProperty(NEXT_KEY)
  public void setNextKey(String nextKey) {
    this.nextKey = nextKey;
    givenKeys.add(NEXT_KEY);
  }

  public String resultsKey() {
    return resultsKey;
  }

  @JsonProperty(RESULTS_KEY)
  public void setResultsKey(String resultsKey) {
    this.resultsKey = resultsKey;
    givenKeys.add(RESULTS_KEY);
  }

  public Boolean hasMeta() {
    return hasMeta;
  }

  @JsonProperty(HAS_META)
  public void setHasMeta(Boolean hasMeta) {
    this.hasMeta = hasMeta;
    givenKeys.add(HAS_META);
  }

  public String metaKey() {
    return metaKey;
  }

  @JsonProperty(META_KEY)
  public void setMetaKey(String metaKey) {
    this.metaKey = metaKey;
    givenKeys.add(META_KEY);
  }

  public String recordIdKey() {
    return recordIdKey;
  }

  @JsonProperty(RECORD_ID_KEY)
  public void setRecordIdKey(String recordIdKey) {
    this.recordIdKey = recordIdKey;
    givenKeys.add(RECORD_ID_KEY);
  }

  public List<String> fields() {
    return fields;
  }

  @JsonProperty(FIELDS)
  public void setFields(List<String> fields) {
    this.fields = fields;
    givenKeys.add(FIELDS);
  }

  public List<String> updateFields() {
    return updateFields;
  }

  @JsonProperty(UPDATE_FIELDS)
  public void setUpdateFields(List<String> updateFields) {
    this.updateFields = updateFields;
    givenKeys.add(UPDATE_FIELDS);
  }

  public Map<String, FieldConfig> fieldConfig() {
    return fieldConfig;
  }

  @JsonProperty(FIELD_CONFIG)
  public void setFieldConfig(Map<String, FieldConfig> fieldConfig) {
    this.fieldConfig = fieldConfig;
    givenKeys.add(FIELD_CONFIG);
  }

  public Map<String, String> renameDataSource() {
    return renameDataSource;
  }

  @JsonProperty(RENAME_DATA_SOURCE)
  public void setRenameDataSource(Map<String, String> renameDataSource) {
    this.renameDataSource = renameDataSource;
    givenKeys.add(RENAME_DATA_SOURCE);
  }

  public String defaultDataSource() {
    return defaultDataSource;
  }

  @JsonProperty(DEFAULT_DATA_SOURCE)
  public void setDefaultDataSource(String defaultDataSource) {
    this.defaultDataSource = defaultDataSource;
    givenKeys.add(DEFAULT_DATA_SOURCE);
  }

  public String defaultParentOrganization() {
    return defaultParentOrganization;
  }

  @JsonProperty(DEFAULT_PARENT_ORGANIZATION)
  public void setDefaultParentOrganization(String defaultParentOrganization) {
    this.defaultParentOrganization = defaultParentOrganization;
    givenKeys.add(DEFAULT_PARENT_ORGANIZATION);
  }

  public List<String> skipClassifications() {
    return skipClassifications;
  }

  @JsonProperty(SKIP_CLASSIFICATIONS)
  public void setSkipClassifications(List<String> skipClassifications) {
    this.skipClassifications = skipClassifications;
    givenKeys.add(SKIP_CLASSIFICATIONS);
  }

  @Override
  public String toString() {
    return "ImportConfigurationOverride" + givenKeys;
  }

  /** Fluent construction; every call marks its key as given, null values included. */
  public static final class Builder {

    private final ImportConfigurationOverride override = new ImportConfigurationOverride();

    private Builder() {}

    public Builder nextKey(String nextKey) {
      override.setNextKey(nextKey);
      return this;
    }

    public Builder resultsKey(String resultsKey) {
      override.setResultsKey(resultsKey);
      return this;
    }

    public Builder hasMeta(Boolean hasMeta) {
      override.setHasMeta(hasMeta);
      return this;
    }

    public Builder metaKey(String metaKey) {
      override.setMetaKey(metaKey);
      return this;
    }

    public Builder recordIdKey(String recordIdKey) {
      override.setRecordIdKey(recordIdKey);
      return this;
    }

    public Builder fields(List<String> fields) {
      override.setFields(fields);
      return this;
    }

    public Builder updateFields(List<String> updateFields) {
      override.setUpdateFields(updateFields);
      return this;
    }

    public Builder fieldConfig(Map<String, FieldConfig> fieldConfig) {
      override.setFieldConfig(fieldConfig);
      return this;
    }

    public Builder renameDataSource(Map<String, String> renameDataSource) {
      override.setRenameDataSource(renameDataSource);
      return this;
    }

    public Builder defaultDataSource(String defaultDataSource) {
      override.setDefaultDataSource(defaultDataSource);
      return this;
    }

    public Builder defaultParentOrganization(String defaultParentOrganization) {
      override.setDefaultParentOrganization(defaultParentOrganization);
      return this;
    }

    public Builder skipClassifications(List<String> skipClassifications) {
      override.setSkipClassifications(skipClassifications);
      return this;
    }

    public ImportConfigurationOverride build() {
      return override;
    }
  }
}
