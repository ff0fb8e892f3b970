package io.b2mash.orghierarchy.importer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete, immutable configuration of one importer. Built by {@link
 * ImportConfigurationResolver} from a named preset and optional overrides.
 *
 * @param nextKey key holding the next page link, or null when the source is not paginated
 * @param resultsKey key holding the record list, or null when records are the response root
 * @param hasMeta whether {@code nextKey} sits inside the {@code metaKey} object
 * @param metaKey key of the pagination metadata object
 * @param recordIdKey raw record key used to index records for {@code org_id} lookups
 * @param fields fields populated when an organization is created
 * @param updateFields fields refreshed when the organization already exists
 * @param fieldConfig per-field behaviour; fields without an entry use {@link FieldConfig#DEFAULT}
 * @param renameDataSource source data source id to local data source id
 * @param defaultDataSource data source for records that carry none
 * @param defaultParentOrganization name of the synthetic root for parentless records, if any
 * @param skipClassifications origin ids of organization classes whose organizations are skipped
 */
public record ImportConfiguration(
    @JsonProperty("next_key") String nextKey,
    @JsonProperty("results_key") String resultsKey,
    @JsonProperty("has_meta") Boolean hasMeta,
    @JsonProperty("meta_key") String metaKey,
    @JsonProperty("record_id_key") String recordIdKey,
    @JsonProperty("fields") List<String> fields,
    @JsonProperty("update_fields") List<String> updateFields,
    @JsonProperty("field_config") Map<String, FieldConfig> fieldConfig,
    @JsonProperty("rename_data_source") Map<String, String> renameDataSource,
    @JsonProperty("default_data_source") String defaultDataSource,
    @JsonProperty("default_parent_organization") String defaultParentOrganization,
    @JsonProperty("skip_classifications") List<String> skipClassifications) {

  public ImportConfiguration {
    hasMeta = Boolean.TRUE.equals(hasMeta);
    metaKey = metaKey != null ? metaKey : "meta";
    recordIdKey = recordIdKey != null ? recordIdKey : "id";
    fields = fields != null ? List.copyOf(fields) : List.of();
    updateFields = updateFields != null ? List.copyOf(updateFields) : List.of();
    fieldConfig = frozen(fieldConfig);
    renameDataSource = frozen(renameDataSource);
    skipClassifications =
        skipClassifications != null ? List.copyOf(skipClassifications) : List.of();
  }

  private static <V> Map<String, V> frozen(Map<String, V> map) {
    return map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Map.of();
  }

  public FieldConfig fieldConfigFor(String field) {
    return fieldConfig.getOrDefault(field, FieldConfig.DEFAULT);
  }

  public boolean hasFieldConfig(String field) {
    return fieldConfig.containsKey(field);
  }

  /** Applies the rename map to a source data source identifier. */
  public String renamedDataSource(String identifier) {
    return renameDataSource.getOrDefault(identifier, identifier);
  }

  public boolean skipsClassification(String classificationOriginId) {
    return skipClassifications.contains(classificationOriginId);
  }

  public boolean hasDefaultParent() {
    return defaultParentOrganization != null && !defaultParentOrganization.isEmpty();
  }

  public ImportConfiguration withRenameDataSource(Map<String, String> renames) {
    return new ImportConfiguration(
        nextKey,
        resultsKey,
        hasMeta,
        metaKey,
        recordIdKey,
        fields,
        updateFields,
        fieldConfig,
        renames,
        defaultDataSource,
        defaultParentOrganization,
        skipClassifications);
  }
}
