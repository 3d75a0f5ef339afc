package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.CalculationIssue;
import java.util.List;

public record CategoryBreakdowns(
    List<CategoryBreakdown> breakdowns,
    BreakdownSummary summary,
    List<CalculationIssue> errors,
    List<CalculationIssue> warnings) {

  public CategoryBreakdowns {
    breakdowns = List.copyOf(breakdowns);
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }
}
