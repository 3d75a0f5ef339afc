package io.b2mash.remodel.measurement;

import io.b2mash.remodel.calculation.CalculationIssue;
import java.math.BigDecimal;
import java.util.List;

/**
 * Material and labor cost of one work item, before any estimate-level adjustment. Amounts are
 * rounded to cents and never negative; they are zero when {@code errors} is non-empty.
 */
public record CostResolution(
    BigDecimal units,
    String unitLabel,
    BigDecimal materialCost,
    BigDecimal laborCost,
    BigDecimal totalCost,
    List<CalculationIssue> errors,
    List<CalculationIssue> warnings) {

  public CostResolution {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
