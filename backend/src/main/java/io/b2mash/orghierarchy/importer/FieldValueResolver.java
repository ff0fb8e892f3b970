package io.b2mash.orghierarchy.importer;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriUtils;

/**
 * Extracts one field's value from a raw source record and transforms it according to the field's
 * {@link FieldConfig}. Values of the relation fields ({@code data_source}, {@code classification},
 * {@code parent}) are handed to the {@link RelatedEntityImporter}, so for those fields the result
 * is a persisted entity.
 */
final class FieldValueResolver {

  private static final Logger log = LoggerFactory.getLogger(FieldValueResolver.class);

  private final SourceClient sourceClient;
  private final URI endpoint;
  private final ImportSession session;
  private final RelatedEntityImporter relatedEntityImporter;

  FieldValueResolver(
      SourceClient sourceClient,
      URI endpoint,
      ImportSession session,
      RelatedEntityImporter relatedEntityImporter) {
    this.sourceClient = sourceClient;
    this.endpoint = endpoint;
    this.session = session;
    this.relatedEntityImporter = relatedEntityImporter;
  }

  /**
   * @throws FieldMissingException if the source key is absent from the record
   * @throws ImportConfigurationException if the field's data type is unknown or lacks a pattern
   */
  Object resolve(Map<String, Object> record, String field, FieldConfig config) {
    Object value = extract(record, field, config);
    if (isEmpty(value)) {
      return value;
    }
    Optional<RelationField> relation = RelationField.fromFieldName(field);
    if (relation.isEmpty()) {
      return value;
    }
    // null for a skipped parent
    return relation.get().importValue(relatedEntityImporter, value);
  }

  /** Same as {@link #resolve} without importing relation values. */
  Object extract(Map<String, Object> record, String field, FieldConfig config) {
    String sourceField = config.sourceFieldOr(field);
    if (!record.containsKey(sourceField)) {
      throw new FieldMissingException("Field not found in source data: " + sourceField);
    }
    Object value = record.get(sourceField);

    if (config.unwrapList() && value instanceof List<?> list) {
      if (list.isEmpty()) {
        return null;
      }
      if (list.size() > 1) {
        log.warn(
            "Field {} has {} values, using the first one: {}", sourceField, list.size(), list);
      }
      value = list.get(0);
    }
    if (isEmpty(value)) {
      return value;
    }

    DataType dataType = DataType.fromValue(config.dataType());
    if (config.unquote()) {
      value = unquote(field, value);
    }
    return switch (dataType) {
      case VALUE -> value;
      case STR_LOWER -> value.toString().toLowerCase(Locale.ROOT);
      case LINK -> linkData(value);
      case REGEX -> extractPattern(field, value, config);
      case ORG_ID -> recordById(field, value.toString());
      case ORG_ID_REGEX -> recordById(field, extractPattern(field, value, config));
    };
  }

  static boolean isEmpty(Object value) {
    return value == null
        || (value instanceof String s && s.isEmpty())
        || (value instanceof Collection<?> c && c.isEmpty())
        || (value instanceof Map<?, ?> m && m.isEmpty());
  }

  private static Object unquote(String field, Object value) {
    if (!(value instanceof String s)) {
      throw new FieldValueException(field, value);
    }
    try {
      return UriUtils.decode(s, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new FieldValueException(field, value, e);
    }
  }

  private Object linkData(Object value) {
    if (!(value instanceof String link)) {
      throw new FetchException("Invalid URL: " + value);
    }
    URI uri;
    try {
      uri = endpoint.resolve(link);
    } catch (IllegalArgumentException e) {
      throw new FetchException("Invalid URL: " + link, e);
    }
    return sourceClient.getJson(uri);
  }

  private static String extractPattern(String field, Object value, FieldConfig config) {
    String pattern = config.pattern();
    if (pattern == null || pattern.isEmpty()) {
      throw new ImportConfigurationException("No regex pattern provided for the field: " + field);
    }
    Matcher matcher;
    try {
      matcher = Pattern.compile(pattern).matcher(value.toString());
    } catch (PatternSyntaxException e) {
      throw new ImportConfigurationException(
          "Invalid regex pattern for the field " + field + ": " + pattern, e);
    }
    if (matcher.groupCount() < 1) {
      throw new ImportConfigurationException(
          "Regex pattern for the field " + field + " has no capture group: " + pattern);
    }
    if (!matcher.find()) {
      throw new FieldPatternException(value.toString(), pattern);
    }
    return matcher.group(1);
  }

  private Map<String, Object> recordById(String field, String id) {
    return session
        .findRecord(id)
        .orElseThrow(
            () ->
                new FieldMissingException(
                    "No source record with id " + id + " referenced by field " + field));
  }
}
