package io.b2mash.orghierarchy.importer.dto;

import io.b2mash.orghierarchy.importer.ImportConfigurationOverride;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

public record ImportRequest(
    @NotBlank(message = "url is required") String url,
    String preset,
    List<String> renameDataSource,
    ImportConfigurationOverride configuration) {}
