package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.estimate.Category;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups the item costs of an existing {@link CalculationPass} by category. It never resolves
 * measurements itself, so per-category sums always agree with the estimate totals.
 */
public class CategoryBreakdownBuilder {

  public CategoryBreakdowns build(CalculationPass pass) {
    var breakdowns = new ArrayList<CategoryBreakdown>();
    int validCategories = 0;
    int totalItems = 0;
    int validItems = 0;

    List<Category> categories = pass.categories();
    for (int ci = 0; ci < categories.size(); ci++) {
      Category category = categories.get(ci);
      if (category == null || category.name() == null || category.name().isBlank()) {
        breakdowns.add(
            new CategoryBreakdown(
                "invalid",
                "Category " + (ci + 1),
                0,
                0,
                Money.ZERO,
                Money.ZERO,
                Money.ZERO,
                BigDecimal.ZERO.setScale(2),
                true));
        continue;
      }

      List<ItemCost> items = pass.itemsOf(ci);
      BigDecimal materialCost = Money.ZERO;
      BigDecimal laborCost = Money.ZERO;
      BigDecimal units = BigDecimal.ZERO.setScale(2);
      int valid = 0;
      for (ItemCost item : items) {
        if (item.valid()) {
          valid++;
          materialCost = materialCost.add(item.materialCost());
          laborCost = laborCost.add(item.laborCost());
          units = units.add(item.units());
        }
      }

      // items skipped by a timeout are not in the pass, so compare against the declared count
      int declared = category.workItems().size();
      boolean hasErrors = valid < declared;
      if (!hasErrors) {
        validCategories++;
      }
      totalItems += declared;
      validItems += valid;

      breakdowns.add(
          new CategoryBreakdown(
              category.key(),
              category.name(),
              declared,
              valid,
              materialCost,
              laborCost,
              materialCost.add(laborCost),
              units,
              hasErrors));
    }

    return new CategoryBreakdowns(
        breakdowns,
        new BreakdownSummary(categories.size(), validCategories, totalItems, validItems),
        pass.errors(),
        warningsFor(pass));
  }

  private static List<CalculationIssue> warningsFor(CalculationPass pass) {
    if (!pass.timedOut()) {
      return pass.warnings();
    }
    var warnings = new ArrayList<>(pass.warnings());
    warnings.add(
        CalculationIssue.of(
            "PARTIAL_BREAKDOWN", "Breakdown is incomplete because the calculation timed out"));
    return warnings;
  }
}
