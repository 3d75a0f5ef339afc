package io.b2mash.remodel.measurement;

import io.b2mash.remodel.calculation.CalculationIssue;
import java.math.BigDecimal;
import java.util.List;

/** Resolved quantity of a work item. {@code units} is zero whenever {@code errors} is non-empty. */
public record UnitResolution(
    BigDecimal units,
    String label,
    MeasurementType measurementType,
    List<CalculationIssue> errors,
    List<CalculationIssue> warnings) {

  public UnitResolution {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
