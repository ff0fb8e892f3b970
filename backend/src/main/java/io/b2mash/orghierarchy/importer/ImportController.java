package io.b2mash.orghierarchy.importer;

import io.b2mash.orghierarchy.importer.dto.ImportRequest;
import io.b2mash.orghierarchy.importer.dto.ImportResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/imports")
public class ImportController {

  private final OrganizationImporterFactory importerFactory;

  public ImportController(OrganizationImporterFactory importerFactory) {
    this.importerFactory = importerFactory;
  }

  /** Runs one import synchronously and returns its statistics. */
  @PostMapping
  public ResponseEntity<ImportResponse> runImport(@Valid @RequestBody ImportRequest request) {
    var importer =
        importerFactory.create(
            request.url(), request.preset(), request.configuration(), request.renameDataSource());
    return ResponseEntity.ok(ImportResponse.of(request.url(), importer.importAll()));
  }
}
