package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.Money;
import java.math.BigDecimal;

/**
 * Outcome of costing one work item during an aggregation pass. Invalid items keep their place in
 * the pass but contribute zero.
 */
public record ItemCost(
    int categoryIndex,
    int itemIndex,
    String itemName,
    BigDecimal units,
    String unitLabel,
    BigDecimal materialCost,
    BigDecimal laborCost,
    boolean valid) {

  static ItemCost invalid(int categoryIndex, int itemIndex, String itemName) {
    return new ItemCost(
        categoryIndex,
        itemIndex,
        itemName,
        BigDecimal.ZERO,
        "units",
        Money.ZERO,
        Money.ZERO,
        false);
  }
}
