package io.b2mash.remodel.estimate;

import io.b2mash.remodel.calculation.CalculationIssue;
import java.util.List;

/**
 * An estimate read from a stored document, in canonical form.
 *
 * @param warnings repairs made while reading, e.g. a migrated deposit or discarded legacy fields
 */
public record EstimateDocument(
    List<Category> categories, Settings settings, List<CalculationIssue> warnings) {

  public EstimateDocument {
    categories = List.copyOf(categories);
    warnings = List.copyOf(warnings);
  }
}
