package io.b2mash.remodel.catalog;

import java.util.List;

/** Catalog entry for a work type. */
public record WorkTypeDetails(
    String type, String categoryKey, List<String> subtypes, String defaultSubtype) {

  public WorkTypeDetails {
    subtypes = subtypes == null ? List.of() : List.copyOf(subtypes);
  }
}
