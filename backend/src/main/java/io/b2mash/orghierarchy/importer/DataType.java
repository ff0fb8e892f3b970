package io.b2mash.orghierarchy.importer;

import java.util.Arrays;
import java.util.stream.Collectors;

/** How a raw source value is transformed before it is assigned to a field. */
public enum DataType {
  VALUE("value"),
  STR_LOWER("str_lower"),
  LINK("link"),
  REGEX("regex"),
  ORG_ID("org_id"),
  ORG_ID_REGEX("org_id_regex");

  private final String value;

  DataType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  boolean needsPattern() {
    return this == REGEX || this == ORG_ID_REGEX;
  }

  /**
   * Parses a configured data type; null means {@link #VALUE}.
   *
   * @throws ImportConfigurationException for unknown names, listing the supported ones
   */
  public static DataType fromValue(String value) {
    if (value == null) {
      return VALUE;
    }
    for (DataType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new ImportConfigurationException(
        "Invalid data type: "
            + value
            + ". Supported data types are: "
            + Arrays.stream(values()).map(DataType::value).collect(Collectors.joining(", ")));
  }
}
