package io.b2mash.orghierarchy.importer;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Builds the effective {@link ImportConfiguration} for a run. Named presets are read from
 * classpath:import-presets/&#42;.json, keyed by file name without the extension.
 */
@Component
public class ImportConfigurationResolver {

  private static final Logger log = LoggerFactory.getLogger(ImportConfigurationResolver.class);
  private static final String PRESET_LOCATION = "classpath:import-presets/*.json";

  private final Map<String, ImportConfiguration> presets;

  public ImportConfigurationResolver(
      ResourcePatternResolver resourceResolver, ObjectMapper objectMapper) {
    this.presets = Collections.unmodifiableMap(loadPresets(resourceResolver, objectMapper));
  }

  private static Map<String, ImportConfiguration> loadPresets(
      ResourcePatternResolver resourceResolver, ObjectMapper objectMapper) {
    Resource[] resources;
    try {
      resources = resourceResolver.getResources(PRESET_LOCATION);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to scan for import presets at " + PRESET_LOCATION, e);
    }
    var loaded = new TreeMap<String, ImportConfiguration>();
    for (Resource resource : resources) {
      String filename = resource.getFilename();
      if (filename == null) {
        continue;
      }
      String name = filename.substring(0, filename.length() - ".json".length());
      try (InputStream in = resource.getInputStream()) {
        loaded.put(name, objectMapper.readValue(in, ImportConfiguration.class));
      } catch (IOException | JacksonException e) {
        throw new IllegalStateException("Failed to parse import preset: " + filename, e);
      }
    }
    log.info("Loaded import presets {}", loaded.keySet());
    return loaded;
  }

  public Set<String> presetNames() {
    return presets.keySet();
  }

  /**
   * @throws ImportConfigurationException if no preset has the given name
   */
  public ImportConfiguration preset(String name) {
    ImportConfiguration preset = presets.get(name);
    if (preset == null) {
      throw new ImportConfigurationException(
          "Unknown import configuration: "
              + name
              + ". Available configurations are: "
              + presets.keySet());
    }
    return preset;
  }

  /**
   * Resolves the configuration for one run: the named preset, merged with {@code override} when
   * given, with the rename map replaced by {@code renames} when that list is non-empty. The result
   * is validated.
   */
  public ImportConfiguration resolve(
      String presetName, ImportConfigurationOverride override, List<String> renames) {
    ImportConfiguration configuration = merge(preset(presetName), override);
    if (renames != null && !renames.isEmpty()) {
      configuration = configuration.withRenameDataSource(DataSourceRenames.parse(renames));
    }
    validate(configuration);
    return configuration;
  }

  /**
   * Every top-level key the override gives replaces the base's value, null included. The merged
   * field config keeps only the fields of the effective {@code fields} list, taking each entry from
   * the override if it has one and from the base otherwise.
   */
  static ImportConfiguration merge(ImportConfiguration base, ImportConfigurationOverride override) {
    if (override == null) {
      return base;
    }
    List<String> fields =
        given(override, ImportConfigurationOverride.FIELDS, override.fields(), base.fields());
    if (fields == null) {
      fields = List.of();
    }
    Map<String, FieldConfig> givenFieldConfig =
        override.fieldConfig() != null ? override.fieldConfig() : Map.of();
    var fieldConfig = new LinkedHashMap<String, FieldConfig>();
    for (String field : fields) {
      if (givenFieldConfig.containsKey(field)) {
        fieldConfig.put(field, givenFieldConfig.get(field));
      } else if (base.hasFieldConfig(field)) {
        fieldConfig.put(field, base.fieldConfig().get(field));
      }
    }
    return new ImportConfiguration(
        given(override, ImportConfigurationOverride.NEXT_KEY, override.nextKey(), base.nextKey()),
        given(
            override,
            ImportConfigurationOverride.RESULTS_KEY,
            override.resultsKey(),
            base.resultsKey()),
        given(override, ImportConfigurationOverride.HAS_META, override.hasMeta(), base.hasMeta()),
        given(override, ImportConfigurationOverride.META_KEY, override.metaKey(), base.metaKey()),
        given(
            override,
            ImportConfigurationOverride.RECORD_ID_KEY,
            override.recordIdKey(),
            base.recordIdKey()),
        fields,
        given(
            override,
            ImportConfigurationOverride.UPDATE_FIELDS,
            override.updateFields(),
            base.updateFields()),
        fieldConfig,
        given(
            override,
            ImportConfigurationOverride.RENAME_DATA_SOURCE,
            override.renameDataSource(),
            base.renameDataSource()),
        given(
            override,
            ImportConfigurationOverride.DEFAULT_DATA_SOURCE,
            override.defaultDataSource(),
            base.defaultDataSource()),
        given(
            override,
            ImportConfigurationOverride.DEFAULT_PARENT_ORGANIZATION,
            override.defaultParentOrganization(),
            base.defaultParentOrganization()),
        given(
            override,
            ImportConfigurationOverride.SKIP_CLASSIFICATIONS,
            override.skipClassifications(),
            base.skipClassifications()));
  }

  private static <T> T given(
      ImportConfigurationOverride override, String key, T overrideValue, T baseValue) {
    return override.isGiven(key) ? overrideValue : baseValue;
  }

  static void validate(ImportConfiguration configuration) {
    var problems = new ArrayList<String>();
    Set<String> supported = OrganizationField.fieldNames();
    for (String field : configuration.fields()) {
      if (!supported.contains(field)) {
        problems.add("unknown field '" + field + "'");
      }
    }
    for (String field : configuration.updateFields()) {
      if (!configuration.fields().contains(field)) {
        problems.add("update field '" + field + "' is not listed in fields");
      }
    }
    for (var entry : configuration.fieldConfig().entrySet()) {
      DataType type = DataType.fromValue(entry.getValue().dataType());
      String pattern = entry.getValue().pattern();
      if (type.needsPattern() && (pattern == null || pattern.isEmpty())) {
        problems.add("field '" + entry.getKey() + "' uses " + type.value() + " without a pattern");
      }
    }
    if (configuration.defaultDataSource() == null
        || configuration.defaultDataSource().isBlank()) {
      problems.add("default_data_source is required");
    }
    if (!problems.isEmpty()) {
      throw new ImportConfigurationException(
          "Invalid import configuration: " + String.join("; ", problems));
    }
  }
}
