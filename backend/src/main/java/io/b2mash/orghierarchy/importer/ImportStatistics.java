package io.b2mash.orghierarchy.importer;

/** Organization counts for one import run. */
public record ImportStatistics(int created, int updated, int skipped) {}
