package io.b2mash.orghierarchy.importer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Parses {@code old:new} data source rename entries given on the command line or in requests. */
public final class DataSourceRenames {

  private DataSourceRenames() {}

  /**
   * @return rename map in entry order; empty for a null or empty list
   * @throws ImportConfigurationException if an entry is not {@code <old>:<new>}
   */
  public static Map<String, String> parse(List<String> entries) {
    var renames = new LinkedHashMap<String, String>();
    if (entries == null) {
      return renames;
    }
    for (String entry : entries) {
      if (entry == null) {
        throw new ImportConfigurationException("Data source rename entry must not be null");
      }
      String[] parts = entry.split(":", -1);
      if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
        throw new ImportConfigurationException(
            "Invalid data source rename '"
                + entry
                + "', expected <old_identifier>:<new_identifier>");
      }
      renames.put(parts[0].trim(), parts[1].trim());
    }
    return renames;
  }
}
