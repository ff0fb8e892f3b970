package io.b2mash.orghierarchy.importer;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-field import behaviour.
 *
 * @param sourceField source record key; defaults to the field name
 * @param dataType one of the {@link DataType} values; defaults to {@code value}
 * @param optional whether a failure to resolve this field only drops the field
 * @param unwrapList take the first element of a list value
 * @param unquote percent-decode the value
 * @param pattern regex whose first group is extracted, for {@code regex} and {@code org_id_regex}
 */
public record FieldConfig(
    @JsonProperty("source_field") String sourceField,
    @JsonProperty("data_type") String dataType,
    @JsonProperty("optional") Boolean optional,
    @JsonProperty("unwrap_list") Boolean unwrapList,
    @JsonProperty("unquote") Boolean unquote,
    @JsonProperty("pattern") String pattern) {

  /** Flags left out of the JSON document are false. */
  public FieldConfig {
    optional = Boolean.TRUE.equals(optional);
    unwrapList = Boolean.TRUE.equals(unwrapList);
    unquote = Boolean.TRUE.equals(unquote);
  }

  public static final FieldConfig DEFAULT = new FieldConfig(null, null, false, false, false, null);

  public static FieldConfig ofType(String dataType) {
    return new FieldConfig(null, dataType, false, false, false, null);
  }

  public String sourceFieldOr(String fieldName) {
    return sourceField != null && !sourceField.isEmpty() ? sourceField : fieldName;
  }

  public FieldConfig withPattern(String pattern) {
    return new FieldConfig(sourceField, dataType, optional, unwrapList, unquote, pattern);
  }
}
