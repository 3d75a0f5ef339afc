package io.b2mash.remodel.testutil;

import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.engine.CalculatorEngineFactory;
import io.b2mash.remodel.engine.EngineOptions;
import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.Surface;
import io.b2mash.remodel.estimate.WorkItem;
import io.b2mash.remodel.measurement.MeasurementResolver;
import io.b2mash.remodel.measurement.MeasurementType;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import tools.jackson.databind.ObjectMapper;

public final class EstimateFixtures {

  public static final String TODAY = "2025-03-15T10:00:00Z";

  private EstimateFixtures() {}

  public static CalculatorEngineFactory engineFactory(Clock clock) {
    var limits = CalculationLimits.defaults();
    return new CalculatorEngineFactory(
        new MeasurementResolver(limits),
        EngineOptions.defaults(),
        limits,
        new ObjectMapper(),
        clock);
  }

  /** Kitchen with 100 sqft of tile at 5.00 material and 3.00 labor per sqft. */
  public static List<Category> kitchen() {
    return List.of(
        new Category(
            "kitchen",
            "Kitchen",
            List.of(tile(new BigDecimal("100"), new BigDecimal("5"), new BigDecimal("3")))));
  }

  public static WorkItem tile(BigDecimal sqft, BigDecimal material, BigDecimal labor) {
    return WorkItem.of(
        "tile", MeasurementType.SQUARE_FOOT, material, labor, List.of(Surface.area(sqft)));
  }

  public static BigDecimal money(String value) {
    return new BigDecimal(value);
  }
}
