package io.b2mash.orghierarchy.importer;

import io.b2mash.orghierarchy.config.ImportClientConfig.ImportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Imports {@code orghierarchy.import.url} on startup when {@code
 * orghierarchy.import.run-on-startup} is set. A failed import is logged and does not stop the
 * application; organizations committed before the failure are kept.
 */
@Component
public class ImportRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(ImportRunner.class);

  private final OrganizationImporterFactory importerFactory;
  private final ImportProperties properties;

  public ImportRunner(OrganizationImporterFactory importerFactory, ImportProperties properties) {
    this.importerFactory = importerFactory;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.runOnStartup()) {
      return;
    }
    log.info("Running startup import of {} with preset {}", properties.url(), properties.preset());
    try {
      var importer =
          importerFactory.create(
              properties.url(), properties.preset(), null, properties.renameDataSource());
      importer.importAll();
    } catch (DataImportException e) {
      log.error("Startup import from {} failed: {}", properties.url(), e.getMessage(), e);
    }
  }
}
