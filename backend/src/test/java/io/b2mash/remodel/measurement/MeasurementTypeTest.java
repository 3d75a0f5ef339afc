package io.b2mash.remodel.measurement;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MeasurementTypeTest {

  @ParameterizedTest
  @ValueSource(strings = {"square-foot", "sqft", "Sq Ft", "square foot (sqft)", "single-surface"})
  void fromValue_squareFootAliases(String raw) {
    assertThat(MeasurementType.fromValue(raw)).contains(MeasurementType.SQUARE_FOOT);
  }

  @ParameterizedTest
  @ValueSource(strings = {"linear-foot", "linear ft", "LinearFt", "linear foot"})
  void fromValue_linearFootAliases(String raw) {
    assertThat(MeasurementType.fromValue(raw)).contains(MeasurementType.LINEAR_FOOT);
  }

  @ParameterizedTest
  @ValueSource(strings = {"by-unit", "by unit", "unit", " units "})
  void fromValue_byUnitAliases(String raw) {
    assertThat(MeasurementType.fromValue(raw)).contains(MeasurementType.BY_UNIT);
  }

  @Test
  void fromValue_unknownIsEmpty() {
    assertThat(MeasurementType.fromValue("cubic-yard")).isEmpty();
    assertThat(MeasurementType.fromValue("  ")).isEmpty();
  }

  @Test
  void normalize_fallsBackToSquareFoot() {
    assertThat(MeasurementType.normalize(null)).isEqualTo(MeasurementType.SQUARE_FOOT);
    assertThat(MeasurementType.normalize("cubic-yard")).isEqualTo(MeasurementType.SQUARE_FOOT);
    assertThat(MeasurementType.normalize("units")).isEqualTo(MeasurementType.BY_UNIT);
  }

  @Test
  void unitLabels() {
    assertThat(MeasurementType.SQUARE_FOOT.getUnitLabel()).isEqualTo("sqft");
    assertThat(MeasurementType.LINEAR_FOOT.getUnitLabel()).isEqualTo("linear ft");
    assertThat(MeasurementType.BY_UNIT.getUnitLabel()).isEqualTo("units");
  }
}
