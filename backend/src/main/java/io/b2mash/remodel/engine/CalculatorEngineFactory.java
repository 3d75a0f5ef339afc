package io.b2mash.remodel.engine;

import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.catalog.WorkTypeCapability;
import io.b2mash.remodel.estimate.Category;
import io.b2mash.remodel.estimate.Settings;
import io.b2mash.remodel.measurement.MeasurementResolver;
import java.time.Clock;
import java.util.List;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

/** Creates engines wired with the configured limits, clock and default options. */
@Service
public class CalculatorEngineFactory {

  private final MeasurementResolver measurementResolver;
  private final EngineOptions defaultOptions;
  private final CalculationLimits limits;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public CalculatorEngineFactory(
      MeasurementResolver measurementResolver,
      EngineOptions defaultOptions,
      CalculationLimits limits,
      ObjectMapper objectMapper,
      Clock clock) {
    this.measurementResolver = measurementResolver;
    this.defaultOptions = defaultOptions;
    this.limits = limits;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public CalculatorEngine create(
      List<Category> categories, Settings settings, WorkTypeCapability catalog) {
    return create(categories, settings, catalog, defaultOptions);
  }

  public CalculatorEngine create(
      List<Category> categories,
      Settings settings,
      WorkTypeCapability catalog,
      EngineOptions options) {
    return new CalculatorEngine(
        categories,
        settings,
        catalog,
        options != null ? options : defaultOptions,
        limits,
        measurementResolver,
        objectMapper,
        clock);
  }

  public CalculationLimits getLimits() {
    return limits;
  }

  public Clock getClock() {
    return clock;
  }

  public EngineOptions getDefaultOptions() {
    return defaultOptions;
  }
}
