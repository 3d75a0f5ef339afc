package io.b2mash.remodel.measurement;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.calculation.Money;
import io.b2mash.remodel.estimate.Surface;
import io.b2mash.remodel.estimate.WorkItem;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Stateless service turning a work item's surfaces into a single quantity and a cost. Never throws
 * for bad data: problems are returned as errors (item degraded to zero units) or warnings.
 */
@Service
public class MeasurementResolver {

  private static final int UNIT_SCALE = 2;

  private final CalculationLimits limits;

  public MeasurementResolver(CalculationLimits limits) {
    this.limits = limits;
  }

  /**
   * Sums the scalar relevant to the item's measurement type across all of its surfaces.
   *
   * @param item the work item; null yields an INVALID_WORK_ITEM error
   * @return units rounded to 2 decimals with the unit label; zero units carry a ZERO_UNITS warning
   */
  public UnitResolution resolveUnits(WorkItem item) {
    var errors = new ArrayList<CalculationIssue>();
    var warnings = new ArrayList<CalculationIssue>();

    if (item == null) {
      errors.add(CalculationIssue.of("INVALID_WORK_ITEM", "Invalid work item"));
      return new UnitResolution(
          BigDecimal.ZERO.setScale(UNIT_SCALE),
          MeasurementType.SQUARE_FOOT.getUnitLabel(),
          MeasurementType.SQUARE_FOOT,
          errors,
          warnings);
    }

    MeasurementType type = item.measurementType();
    if (type == null) {
      type = MeasurementType.SQUARE_FOOT;
      warnings.add(
          CalculationIssue.of(
              "MEASUREMENT_TYPE_DEFAULTED",
              "Work item has no measurement type, defaulting to " + type.getValue()));
    }

    List<Surface> surfaces = item.surfaces();
    if (surfaces.size() > limits.maxSurfacesPerItem()) {
      errors.add(
          CalculationIssue.of(
              "TOO_MANY_SURFACES",
              "Work item has "
                  + surfaces.size()
                  + " surfaces, the maximum is "
                  + limits.maxSurfacesPerItem(),
              Map.of("surfaceCount", surfaces.size())));
      return degraded(type, errors, warnings);
    }

    BigDecimal total = BigDecimal.ZERO;
    for (int i = 0; i < surfaces.size(); i++) {
      Surface surface = surfaces.get(i);
      int position = i + 1;
      if (surface == null) {
        errors.add(
            CalculationIssue.of(
                "INVALID_SURFACE", "Surface " + position + " is invalid", Map.of("index", i)));
        continue;
      }

      BigDecimal value = measure(type, surface);
      if (value == null) {
        errors.add(
            CalculationIssue.of(
                "MISSING_MEASUREMENT",
                "Surface " + position + " is missing a numeric " + requiredFields(type),
                Map.of("index", i, "measurementType", type.getValue())));
        continue;
      }
      if (value.signum() < 0) {
        errors.add(
            CalculationIssue.of(
                "NEGATIVE_MEASUREMENT",
                "Surface " + position + " has a negative measurement",
                Map.of("index", i, "value", value)));
        continue;
      }
      total = total.add(value);
    }

    if (!errors.isEmpty()) {
      return degraded(type, errors, warnings);
    }

    total = total.setScale(UNIT_SCALE, RoundingMode.HALF_UP);
    if (total.compareTo(limits.maxUnits()) > 0) {
      errors.add(
          CalculationIssue.of(
              "UNITS_EXCEED_LIMIT",
              "Units exceed maximum limit: " + total.toPlainString(),
              Map.of("units", total, "maxUnits", limits.maxUnits())));
      return degraded(type, errors, warnings);
    }
    if (total.signum() == 0) {
      warnings.add(
          CalculationIssue.of(
              "ZERO_UNITS",
              "Work item '" + item.displayName() + "' resolves to zero " + type.getUnitLabel()));
    }

    return new UnitResolution(total, type.getUnitLabel(), type, errors, warnings);
  }

  /**
   * Multiplies the resolved units by the per-unit costs. Unit errors and invalid per-unit costs
   * degrade the result to zero and are returned in {@code errors}.
   */
  public CostResolution resolveCost(WorkItem item) {
    UnitResolution resolution = resolveUnits(item);
    var errors = new ArrayList<>(resolution.errors());
    var warnings = new ArrayList<>(resolution.warnings());

    if (item == null) {
      return new CostResolution(
          resolution.units(),
          resolution.label(),
          Money.ZERO,
          Money.ZERO,
          Money.ZERO,
          errors,
          warnings);
    }

    BigDecimal materialRate = validateRate(item.materialCostPerUnit(), "material cost", errors);
    BigDecimal laborRate = validateRate(item.laborCostPerUnit(), "labor cost", errors);

    if (!errors.isEmpty()) {
      return new CostResolution(
          BigDecimal.ZERO.setScale(UNIT_SCALE),
          resolution.label(),
          Money.ZERO,
          Money.ZERO,
          Money.ZERO,
          errors,
          warnings);
    }

    BigDecimal materialCost = Money.nonNegative(resolution.units().multiply(materialRate));
    BigDecimal laborCost = Money.nonNegative(resolution.units().multiply(laborRate));
    return new CostResolution(
        resolution.units(),
        resolution.label(),
        materialCost,
        laborCost,
        materialCost.add(laborCost),
        errors,
        warnings);
  }

  private BigDecimal validateRate(
      BigDecimal rate, String fieldName, List<CalculationIssue> errors) {
    if (rate == null) {
      return BigDecimal.ZERO;
    }
    if (rate.signum() < 0) {
      errors.add(
          CalculationIssue.of(
              "NEGATIVE_COST",
              "Invalid " + fieldName + ": cannot be negative",
              Map.of("field", fieldName, "value", rate)));
      return BigDecimal.ZERO;
    }
    if (rate.compareTo(limits.maxCost()) > 0) {
      errors.add(
          CalculationIssue.of(
              "COST_EXCEEDS_LIMIT",
              "Invalid " + fieldName + ": exceeds maximum limit",
              Map.of("field", fieldName, "value", rate)));
      return BigDecimal.ZERO;
    }
    return rate;
  }

  private static BigDecimal measure(MeasurementType type, Surface surface) {
    return switch (type) {
      case SQUARE_FOOT -> area(surface);
      case LINEAR_FOOT -> surface.linearFt();
      case BY_UNIT -> surface.units();
    };
  }

  // sqft wins when positive; otherwise width x height
  private static BigDecimal area(Surface surface) {
    if (surface.sqft() != null && surface.sqft().signum() > 0) {
      return surface.sqft();
    }
    if (surface.width() != null && surface.height() != null) {
      return surface.width().multiply(surface.height());
    }
    return surface.sqft();
  }

  private static String requiredFields(MeasurementType type) {
    return switch (type) {
      case SQUARE_FOOT -> "sqft or width/height";
      case LINEAR_FOOT -> "linearFt";
      case BY_UNIT -> "units";
    };
  }

  private static UnitResolution degraded(
      MeasurementType type, List<CalculationIssue> errors, List<CalculationIssue> warnings) {
    return new UnitResolution(
        BigDecimal.ZERO.setScale(UNIT_SCALE), type.getUnitLabel(), type, errors, warnings);
  }
}
