package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.estimate.Category;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single per-item traversal of an estimate. Totals and category breakdowns are both derived
 * from the same pass so their sums always agree.
 *
 * @param categories the categories as traversed, including invalid (null or unnamed) entries
 * @param items one entry per visited work item, in traversal order
 * @param timedOut true when the pass stopped early at the timeout ceiling
 */
public record CalculationPass(
    List<Category> categories,
    List<ItemCost> items,
    List<CalculationIssue> errors,
    List<CalculationIssue> warnings,
    boolean timedOut) {

  public CalculationPass {
    categories = Collections.unmodifiableList(new ArrayList<>(categories));
    items = List.copyOf(items);
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public List<ItemCost> itemsOf(int categoryIndex) {
    return items.stream().filter(item -> item.categoryIndex() == categoryIndex).toList();
  }
}
