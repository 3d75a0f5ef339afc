package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.Money;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimate totals. Every amount has scale 2 and the components add up exactly:
 *
 * <pre>
 * subtotal = materialCost + laborCost
 * laborCost = laborCostBeforeDiscount - laborDiscount
 * total = subtotal + wasteCost + taxAmount + markupAmount + miscFeesTotal + transportationFee
 * </pre>
 *
 * @param laborDiscount the discount amount taken off labor
 * @param laborDiscountRate the applied discount fraction, after clamping to [0, 1]
 */
public record Totals(
    BigDecimal materialCost,
    BigDecimal laborCost,
    BigDecimal laborCostBeforeDiscount,
    BigDecimal laborDiscount,
    BigDecimal laborDiscountRate,
    BigDecimal wasteCost,
    BigDecimal taxAmount,
    BigDecimal markupAmount,
    BigDecimal transportationFee,
    BigDecimal miscFeesTotal,
    BigDecimal subtotal,
    BigDecimal total,
    BigDecimal totalUnits,
    TotalsSummary summary,
    List<CalculationIssue> errors,
    List<CalculationIssue> warnings) {

  public Totals {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  /** Monetary fields rendered as fixed two-decimal strings, in declaration order. */
  public Map<String, String> formatted() {
    var values = new LinkedHashMap<String, String>();
    values.put("materialCost", Money.format(materialCost));
    values.put("laborCost", Money.format(laborCost));
    values.put("laborCostBeforeDiscount", Money.format(laborCostBeforeDiscount));
    values.put("laborDiscount", Money.format(laborDiscount));
    values.put("wasteCost", Money.format(wasteCost));
    values.put("taxAmount", Money.format(taxAmount));
    values.put("markupAmount", Money.format(markupAmount));
    values.put("transportationFee", Money.format(transportationFee));
    values.put("miscFeesTotal", Money.format(miscFeesTotal));
    values.put("subtotal", Money.format(subtotal));
    values.put("total", Money.format(total));
    return values;
  }
}
