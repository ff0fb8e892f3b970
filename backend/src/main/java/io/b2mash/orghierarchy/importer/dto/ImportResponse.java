package io.b2mash.orghierarchy.importer.dto;

import io.b2mash.orghierarchy.importer.ImportStatistics;

public record ImportResponse(String url, int created, int updated, int skipped) {

  public static ImportResponse of(String url, ImportStatistics statistics) {
    return new ImportResponse(
        url, statistics.created(), statistics.updated(), statistics.skipped());
  }
}
