package io.b2mash.remodel.measurement;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.remodel.calculation.CalculationIssue;
import io.b2mash.remodel.calculation.CalculationLimits;
import io.b2mash.remodel.estimate.Surface;
import io.b2mash.remodel.estimate.WorkItem;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class MeasurementResolverTest {

  private final MeasurementResolver resolver =
      new MeasurementResolver(CalculationLimits.defaults());

  @Test
  void resolveUnits_sumsAreaAcrossSurfaces() {
    var item =
        item(
            MeasurementType.SQUARE_FOOT,
            Surface.area(new BigDecimal("40")),
            Surface.rectangle(new BigDecimal("5"), new BigDecimal("12")));

    var result = resolver.resolveUnits(item);

    assertThat(result.units()).isEqualByComparingTo("100.00");
    assertThat(result.label()).isEqualTo("sqft");
    assertThat(result.errors()).isEmpty();
  }

  @Test
  void resolveUnits_sqftWinsOverWidthAndHeight() {
    BigDecimal two = new BigDecimal("2");
    var surface = new Surface("wall", new BigDecimal("30"), two, two, null, null, null);

    var result = resolver.resolveUnits(item(MeasurementType.SQUARE_FOOT, surface));

    assertThat(result.units()).isEqualByComparingTo("30");
  }

  @Test
  void resolveUnits_linearAndCount() {
    var trim =
        item(
            MeasurementType.LINEAR_FOOT,
            Surface.length(new BigDecimal("12.5")),
            Surface.length(new BigDecimal("7.25")));
    var fixtures = item(MeasurementType.BY_UNIT, Surface.count(new BigDecimal("3")));

    assertThat(resolver.resolveUnits(trim).units()).isEqualByComparingTo("19.75");
    assertThat(resolver.resolveUnits(trim).label()).isEqualTo("linear ft");
    assertThat(resolver.resolveUnits(fixtures).units()).isEqualByComparingTo("3");
    assertThat(resolver.resolveUnits(fixtures).label()).isEqualTo("units");
  }

  @Test
  void resolveUnits_roundsToTwoDecimals() {
    var item = item(MeasurementType.LINEAR_FOOT, Surface.length(new BigDecimal("3.335")));

    assertThat(resolver.resolveUnits(item).units()).isEqualByComparingTo("3.34");
  }

  @Test
  void resolveUnits_zeroUnitsIsAWarningNotAnError() {
    var item = item(MeasurementType.SQUARE_FOOT, Surface.area(BigDecimal.ZERO));

    var result = resolver.resolveUnits(item);

    assertThat(result.units()).isEqualByComparingTo("0");
    assertThat(result.errors()).isEmpty();
    assertThat(codes(result.warnings())).containsExactly("ZERO_UNITS");
  }

  @Test
  void resolveUnits_noSurfacesWarnsZeroUnits() {
    var item = WorkItem.of("paint", MeasurementType.SQUARE_FOOT, null, null, List.of());

    var result = resolver.resolveUnits(item);

    assertThat(result.hasErrors()).isFalse();
    assertThat(codes(result.warnings())).containsExactly("ZERO_UNITS");
  }

  @Test
  void resolveUnits_missingFieldDegradesToZero() {
    var item =
        item(
            MeasurementType.LINEAR_FOOT,
            Surface.length(new BigDecimal("10")),
            Surface.area(new BigDecimal("10")));

    var result = resolver.resolveUnits(item);

    assertThat(result.units()).isEqualByComparingTo("0");
    assertThat(codes(result.errors())).containsExactly("MISSING_MEASUREMENT");
    assertThat(result.errors().get(0).context()).containsEntry("index", 1);
  }

  @Test
  void resolveUnits_negativeAndNullSurfacesAreErrors() {
    var item =
        new WorkItem(
            "tile",
            null,
            null,
            MeasurementType.BY_UNIT,
            null,
            null,
            Arrays.asList(Surface.count(new BigDecimal("-2")), null),
            null);

    var result = resolver.resolveUnits(item);

    assertThat(result.units()).isEqualByComparingTo("0");
    assertThat(codes(result.errors())).containsExactly("NEGATIVE_MEASUREMENT", "INVALID_SURFACE");
  }

  @Test
  void resolveUnits_missingMeasurementTypeDefaultsToSquareFoot() {
    var item = item(null, Surface.area(new BigDecimal("12")));

    var result = resolver.resolveUnits(item);

    assertThat(result.measurementType()).isEqualTo(MeasurementType.SQUARE_FOOT);
    assertThat(result.units()).isEqualByComparingTo("12");
    assertThat(codes(result.warnings())).containsExactly("MEASUREMENT_TYPE_DEFAULTED");
  }

  @Test
  void resolveUnits_nullItem() {
    var result = resolver.resolveUnits(null);

    assertThat(codes(result.errors())).containsExactly("INVALID_WORK_ITEM");
    assertThat(result.units()).isEqualByComparingTo("0");
  }

  @Test
  void resolveUnits_overLimitIsAnError() {
    var item = item(MeasurementType.SQUARE_FOOT, Surface.area(new BigDecimal("50000.01")));

    var result = resolver.resolveUnits(item);

    assertThat(codes(result.errors())).containsExactly("UNITS_EXCEED_LIMIT");
    assertThat(result.units()).isEqualByComparingTo("0");
  }

  @Test
  void resolveUnits_tooManySurfaces() {
    var surfaces = Collections.nCopies(101, Surface.count(BigDecimal.ONE));
    var item = WorkItem.of("outlet", MeasurementType.BY_UNIT, null, null, surfaces);

    assertThat(codes(resolver.resolveUnits(item).errors())).containsExactly("TOO_MANY_SURFACES");
  }

  @Test
  void resolveCost_multipliesUnitsByRates() {
    var item =
        WorkItem.of(
            "tile",
            MeasurementType.SQUARE_FOOT,
            new BigDecimal("5"),
            new BigDecimal("3.333"),
            List.of(Surface.area(new BigDecimal("100"))));

    var cost = resolver.resolveCost(item);

    assertThat(cost.materialCost()).isEqualByComparingTo("500.00");
    assertThat(cost.laborCost()).isEqualByComparingTo("333.30");
    assertThat(cost.totalCost()).isEqualByComparingTo("833.30");
    assertThat(cost.unitLabel()).isEqualTo("sqft");
  }

  @Test
  void resolveCost_negativeRateZeroesTheItem() {
    var item =
        WorkItem.of(
            "tile",
            MeasurementType.SQUARE_FOOT,
            new BigDecimal("-1"),
            new BigDecimal("3"),
            List.of(Surface.area(new BigDecimal("100"))));

    var cost = resolver.resolveCost(item);

    assertThat(codes(cost.errors())).containsExactly("NEGATIVE_COST");
    assertThat(cost.materialCost()).isEqualByComparingTo("0");
    assertThat(cost.laborCost()).isEqualByComparingTo("0");
    assertThat(cost.units()).isEqualByComparingTo("0");
  }

  @Test
  void resolveCost_propagatesUnitErrors() {
    var item =
        WorkItem.of(
            "trim",
            MeasurementType.LINEAR_FOOT,
            new BigDecimal("2"),
            new BigDecimal("2"),
            List.of(Surface.area(new BigDecimal("10"))));

    var cost = resolver.resolveCost(item);

    assertThat(cost.hasErrors()).isTrue();
    assertThat(cost.totalCost()).isEqualByComparingTo("0");
  }

  private static WorkItem item(MeasurementType type, Surface... surfaces) {
    return WorkItem.of("tile", type, null, null, List.of(surfaces));
  }

  private static List<String> codes(List<CalculationIssue> issues) {
    return issues.stream().map(CalculationIssue::code).toList();
  }
}
