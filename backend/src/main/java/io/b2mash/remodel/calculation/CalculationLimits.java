package io.b2mash.remodel.calculation;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Guard rails the engine clamps or validates against.
 *
 * @param maxUnits largest resolved quantity for one work item; larger totals invalidate the item
 * @param maxCost largest accepted per-unit material or labor cost
 * @param maxTaxRate upper bound for the tax rate fraction
 * @param maxMarkupRate upper bound for the markup fraction
 * @param maxWasteFactor upper bound for a waste entry's factor
 * @param maxPaymentAmount largest single payment or deposit
 * @param maxInstallmentPeriods largest installment plan length, in months
 * @param maxSurfacesPerItem most surfaces a work item may carry
 */
@ConfigurationProperties(prefix = "estimator.limits")
public record CalculationLimits(
    BigDecimal maxUnits,
    BigDecimal maxCost,
    BigDecimal maxTaxRate,
    BigDecimal maxMarkupRate,
    BigDecimal maxWasteFactor,
    BigDecimal maxPaymentAmount,
    int maxInstallmentPeriods,
    int maxSurfacesPerItem) {

  public static CalculationLimits defaults() {
    return new CalculationLimits(
        new BigDecimal("50000"),
        new BigDecimal("10000000"),
        new BigDecimal("0.25"),
        new BigDecimal("5.0"),
        new BigDecimal("0.50"),
        new BigDecimal("100000"),
        60,
        100);
  }
}
