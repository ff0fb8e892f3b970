package io.b2mash.orghierarchy.importer;

import io.b2mash.orghierarchy.config.ImportClientConfig.ImportProperties;
import io.b2mash.orghierarchy.organization.OrganizationStore;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/** Creates one {@link OrganizationImporter}, with fresh run caches, per import run. */
@Component
public class OrganizationImporterFactory {

  private final ImportConfigurationResolver configurationResolver;
  private final SourceClient sourceClient;
  private final OrganizationStore store;
  private final TransactionTemplate transactionTemplate;
  private final ImportProperties properties;

  public OrganizationImporterFactory(
      ImportConfigurationResolver configurationResolver,
      SourceClient sourceClient,
      OrganizationStore store,
      TransactionTemplate transactionTemplate,
      ImportProperties properties) {
    this.configurationResolver = configurationResolver;
    this.sourceClient = sourceClient;
    this.store = store;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  /**
   * @param url endpoint to import, absolute
   * @param preset preset name; the configured default preset when null
   * @param override changes to the preset, may be null
   * @param renames {@code old:new} data source renames, may be null or empty
   * @throws ImportConfigurationException if the url, preset, override or renames are invalid
   */
  public OrganizationImporter create(
      String url, String preset, ImportConfigurationOverride override, List<String> renames) {
    String presetName = preset != null && !preset.isBlank() ? preset : properties.preset();
    ImportConfiguration configuration =
        configurationResolver.resolve(presetName, override, renames);
    return new OrganizationImporter(
        endpoint(url), configuration, sourceClient, store, transactionTemplate);
  }

  /** Parses the endpoint; an empty path becomes {@code /} so relative links resolve below it. */
  static URI endpoint(String url) {
    if (url == null || url.isBlank()) {
      throw new ImportConfigurationException("Import url is required");
    }
    try {
      URI uri = new URI(url.trim());
      if (!uri.isAbsolute()) {
        throw new ImportConfigurationException("Import url must be absolute: " + url);
      }
      if (!uri.isOpaque() && (uri.getRawPath() == null || uri.getRawPath().isEmpty())) {
        return UriComponentsBuilder.fromUri(uri).path("/").build(true).toUri();
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new ImportConfigurationException("Invalid import url: " + url, e);
    }
  }
}
