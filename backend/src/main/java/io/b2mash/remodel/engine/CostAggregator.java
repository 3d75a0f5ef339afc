package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.MiscFee;
import io.b2mash.remodel.estimate.Settings;
import io.b2mash.remodel.estimate.WasteEntry;
import io.b2mash.remodel.estimate.WorkItem;
import io.b2mash.remodel.measurement.CostResolution;
import io.b2mash.remodel.measurement.MeasurementResolver;
import io.b2mash.remodel.measurement.MeasurementType;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Costs every work item once and folds the results into estimate totals.
 *
 * <p>Adjustments are applied in a fixed order:
 *
 * <ol>
 *   <li>labor discount: {@code laborCost = laborCostBeforeDiscount × (1 − laborDiscount)}
 *   <li>{@code subtotal = materialCost + laborCost}
 *   <li>waste from the estimate-level waste entries: {@code Σ surfaceCost × wasteFactor}, or
 *       {@code materialCost × settings.wasteFactor} when there are no entries
 *   <li>tax and markup, each a percentage of {@code subtotal + waste} (not of each other)
 *   <li>miscellaneous fees and the transportation fee, as flat additions
 * </ol>
 *
 * Each component is rounded to cents before it is added, so the printed components always sum to
 * the printed total.
 */
public class CostAggregator {

  private static final Logger log = LoggerFactory.getLogger(CostAggregator.class);

  private final MeasurementResolver measurementResolver;
  private final WorkTypeCapability catalog;
  private final EngineOptions options;
  private final CalculationLimits limits;
  private final Clock clock;

  public CostAggregator(
      MeasurementResolver measurementResolver,
      WorkTypeCapability catalog,
      EngineOptions options,
      CalculationLimits limits,
      Clock clock) {
    this.measurementResolver = measurementResolver;
    this.catalog = catalog;
    this.options = options;
    this.limits = limits;
    this.clock = clock;
  }

  /**
   * Visits every work item of every category exactly once. A failing item is recorded as invalid
   * and the traversal continues; only the timeout ceiling stops it early.
   */
  public CalculationPass traverse(List<Category> categories) {
    var items = new ArrayList<ItemCost>();
    var errors = new ArrayList<CalculationIssue>();
    var warnings = new ArrayList<CalculationIssue>();
    long start = clock.millis();
    boolean timedOut = false;

    for (int ci = 0; ci < categories.size() && !timedOut; ci++) {
      Category category = categories.get(ci);
      if (category == null || category.name() == null || category.name().isBlank()) {
        errors.add(
            CalculationIssue.of(
                "INVALID_CATEGORY", "Invalid category at index " + ci, Map.of("index", ci)));
        continue;
      }

      List<WorkItem> workItems = category.workItems();
      for (int ii = 0; ii < workItems.size(); ii++) {
        if (options.timeoutMs() > 0 && clock.millis() - start > options.timeoutMs()) {
          log.warn(
              "Aggregation exceeded {} ms at category '{}', item {}; remaining items skipped",
              options.timeoutMs(),
              category.name(),
              ii);
          errors.add(
              CalculationIssue.of(
                  "CALCULATION_TIMEOUT",
                  "Calculation exceeded " + options.timeoutMs() + " ms; remaining items skipped",
                  Map.of("categoryName", category.name(), "itemIndex", ii)));
          timedOut = true;
          break;
        }
        items.add(costItem(category, ci, workItems.get(ii), ii, errors, warnings));
      }
    }

    return new CalculationPass(categories, items, errors, warnings, timedOut);
  }

  /** Applies discount, waste, tax, markup and fees to a finished pass. */
  public Totals summarize(CalculationPass pass, Settings settings) {
    var errors = new ArrayList<>(pass.errors());
    var warnings = new ArrayList<>(pass.warnings());

    BigDecimal materialCost = Money.ZERO;
    BigDecimal laborCostBeforeDiscount = Money.ZERO;
    BigDecimal totalUnits = BigDecimal.ZERO;
    int validItems = 0;
    for (ItemCost item : pass.items()) {
      if (!item.valid()) {
        continue;
      }
      validItems++;
      materialCost = materialCost.add(item.materialCost());
      laborCostBeforeDiscount = laborCostBeforeDiscount.add(item.laborCost());
      totalUnits = totalUnits.add(item.units());
    }

    BigDecimal discountRate =
        clampRate(settings.laborDiscount(), BigDecimal.ONE, "laborDiscount", warnings);
    BigDecimal laborCost =
        Money.round(laborCostBeforeDiscount.multiply(BigDecimal.ONE.subtract(discountRate)));
    BigDecimal laborDiscount = laborCostBeforeDiscount.subtract(laborCost);
    BigDecimal subtotal = materialCost.add(laborCost);

    BigDecimal wasteCost = wasteCost(settings, materialCost, warnings);
    BigDecimal taxableBase = subtotal.add(wasteCost);

    BigDecimal taxRate = clampRate(settings.taxRate(), limits.maxTaxRate(), "taxRate", warnings);
    BigDecimal markupRate =
        clampRate(settings.markup(), limits.maxMarkupRate(), "markup", warnings);
    BigDecimal taxAmount = Money.round(taxableBase.multiply(taxRate));
    BigDecimal markupAmount = Money.round(taxableBase.multiply(markupRate));

    BigDecimal miscFeesTotal = miscFeesTotal(settings.miscFees(), warnings);
    BigDecimal transportationFee =
        nonNegativeFee(settings.transportationFee(), "transportationFee", warnings);

    BigDecimal total =
        taxableBase.add(taxAmount).add(markupAmount).add(miscFeesTotal).add(transportationFee);

    int totalItems = pass.items().size();
    return new Totals(
        materialCost,
        laborCost,
        laborCostBeforeDiscount,
        laborDiscount,
        discountRate,
        wasteCost,
        taxAmount,
        markupAmount,
        transportationFee,
        miscFeesTotal,
        subtotal,
        total,
        totalUnits.setScale(2),
        new TotalsSummary(
            totalItems, validItems, totalItems - validItems, pass.categories().size()),
        errors,
        warnings);
  }

  private ItemCost costItem(
      Category category,
      int categoryIndex,
      WorkItem item,
      int itemIndex,
      List<CalculationIssue> errors,
      List<CalculationIssue> warnings) {
    var context = new LinkedHashMap<String, Object>();
    context.put("categoryKey", category.key());
    context.put("categoryName", category.name());
    context.put("itemIndex", itemIndex);

    if (item == null) {
      errors.add(CalculationIssue.of("INVALID_WORK_ITEM", "Invalid work item", context));
      return ItemCost.invalid(categoryIndex, itemIndex, "Unnamed Work Item");
    }
    context.put("itemName", item.displayName());

    var itemErrors = new ArrayList<CalculationIssue>();
    var itemWarnings = new ArrayList<CalculationIssue>();
    try {
      WorkItem reconciled = reconcileWithCatalog(category, item, itemErrors, itemWarnings);
      CostResolution cost = measurementResolver.resolveCost(reconciled);
      itemErrors.addAll(cost.errors());
      itemWarnings.addAll(cost.warnings());

      itemErrors.forEach(issue -> errors.add(withContext(issue, context)));
      itemWarnings.forEach(issue -> warnings.add(withContext(issue, context)));

      if (!itemErrors.isEmpty()) {
        warnings.add(
            CalculationIssue.of(
                "ITEM_CALCULATION_FAILED",
                "Item calculation failed: " + item.displayName() + " in " + category.name(),
                context));
        return ItemCost.invalid(categoryIndex, itemIndex, item.displayName());
      }

      return new ItemCost(
          categoryIndex,
          itemIndex,
          item.displayName(),
          cost.units(),
          cost.unitLabel(),
          cost.materialCost(),
          cost.laborCost(),
          true);
    } catch (RuntimeException e) {
      log.warn("Error processing item {} in category '{}'", itemIndex, category.name(), e);
      errors.add(
          withContext(
              CalculationIssue.of(
                  "ITEM_PROCESSING_ERROR", "Error processing item: " + e.getMessage()),
              context));
      return ItemCost.invalid(categoryIndex, itemIndex, item.displayName());
    }
  }

  private WorkItem reconcileWithCatalog(
      Category category,
      WorkItem item,
      List<CalculationIssue> errors,
      List<CalculationIssue> warnings) {
    boolean strict = options.strictValidation();

    if (item.type() == null || item.type().isBlank()) {
      flag(strict, "MISSING_WORK_TYPE", "Work item is missing a work type", errors, warnings);
      return item;
    }
    if (item.isCustomType()) {
      if (item.customName() == null || item.customName().isBlank()) {
        flag(strict, "CUSTOM_NAME_MISSING", "Custom work type is missing a name", errors, warnings);
      }
      return item;
    }

    WorkItem result = item;
    try {
      MeasurementType prescribed = catalog.resolveMeasurementType(category.key(), item.type());
      if (prescribed != null && prescribed != item.measurementType()) {
        if (item.measurementType() != null) {
          log.warn(
              "Work item '{}' in '{}' uses {} but the catalog prescribes {}; coercing",
              item.displayName(),
              category.name(),
              item.measurementType(),
              prescribed);
          warnings.add(
              CalculationIssue.of(
                  "MEASUREMENT_TYPE_COERCED",
                  "Measurement type "
                      + item.measurementType().getValue()
                      + " replaced by catalog type "
                      + prescribed.getValue(),
                  Map.of("from", item.measurementType(), "to", prescribed)));
        }
        result = item.withMeasurementType(prescribed);
      }

      if (catalog.getWorkTypeDetails(item.type()) == null) {
        flag(
            strict,
            "UNKNOWN_WORK_TYPE",
            "Work type '" + item.type() + "' is not in the catalog",
            errors,
            warnings);
      }
      if (item.subtype() != null
          && !item.subtype().isBlank()
          && !catalog.isValidSubtype(item.type(), item.subtype())) {
        flag(
            strict,
            "INVALID_SUBTYPE",
            "Subtype '" + item.subtype() + "' is not valid for work type '" + item.type() + "'",
            errors,
            warnings);
      }
    } catch (RuntimeException e) {
      log.warn("Work type catalog lookup failed for '{}'", item.type(), e);
      warnings.add(
          CalculationIssue.of(
              "CATALOG_LOOKUP_FAILED", "Work type catalog lookup failed: " + e.getMessage()));
    }
    return result;
  }

  private BigDecimal wasteCost(
      Settings settings, BigDecimal materialCost, List<CalculationIssue> warnings) {
    if (settings.wasteEntries().isEmpty()) {
      if (settings.wasteFactor().signum() == 0) {
        return Money.ZERO;
      }
      BigDecimal factor =
          clampRate(settings.wasteFactor(), limits.maxWasteFactor(), "wasteFactor", warnings);
      return Money.round(materialCost.multiply(factor));
    }
    BigDecimal waste = BigDecimal.ZERO;
    for (WasteEntry entry : settings.wasteEntries()) {
      if (entry == null) {
        warnings.add(CalculationIssue.of("INVALID_WASTE_ENTRY", "Ignored an empty waste entry"));
        continue;
      }
      BigDecimal surfaceCost =
          entry.surfaceCost() == null ? BigDecimal.ZERO : entry.surfaceCost().max(BigDecimal.ZERO);
      BigDecimal factor =
          clampRate(entry.wasteFactor(), limits.maxWasteFactor(), "wasteFactor", warnings);
      waste = waste.add(surfaceCost.multiply(factor));
    }
    return Money.round(waste);
  }

  private BigDecimal miscFeesTotal(List<MiscFee> fees, List<CalculationIssue> warnings) {
    BigDecimal total = Money.ZERO;
    for (MiscFee fee : fees) {
      if (fee == null) {
        continue;
      }
      total = total.add(nonNegativeFee(fee.amount(), "miscFee:" + fee.name(), warnings));
    }
    return total;
  }

  private static BigDecimal nonNegativeFee(
      BigDecimal amount, String field, List<CalculationIssue> warnings) {
    if (amount == null) {
      return Money.ZERO;
    }
    if (amount.signum() < 0) {
      warnings.add(
          CalculationIssue.of(
              "NEGATIVE_FEE",
              "Negative " + field + " ignored",
              Map.of("field", field, "value", amount)));
      return Money.ZERO;
    }
    return Money.round(amount);
  }

  private static BigDecimal clampRate(
      BigDecimal rate, BigDecimal max, String field, List<CalculationIssue> warnings) {
    if (rate == null) {
      return BigDecimal.ZERO;
    }
    if (rate.signum() < 0) {
      warnings.add(clampWarning(field, rate, BigDecimal.ZERO));
      return BigDecimal.ZERO;
    }
    if (rate.compareTo(max) > 0) {
      warnings.add(clampWarning(field, rate, max));
      return max;
    }
    return rate;
  }

  private static CalculationIssue clampWarning(String field, BigDecimal value, BigDecimal clamped) {
    log.warn("Clamped {} from {} to {}", field, value, clamped);
    return CalculationIssue.of(
        "RATE_CLAMPED",
        field + " " + value.toPlainString() + " is out of range, using " + clamped.toPlainString(),
        Map.of("field", field, "value", value, "applied", clamped));
  }

  private static void flag(
      boolean strict,
      String code,
      String message,
      List<CalculationIssue> errors,
      List<CalculationIssue> warnings) {
    var issue = CalculationIssue.of(code, message);
    if (strict) {
      errors.add(issue);
    } else {
      warnings.add(issue);
    }
  }

  private static CalculationIssue withContext(
      CalculationIssue issue, Map<String, Object> context) {
    var merged = new LinkedHashMap<String, Object>(context);
    merged.putAll(issue.context());
    return CalculationIssue.of(issue.code(), issue.message(), merged);
  }
}
