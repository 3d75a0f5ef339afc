package io.b2mash.remodel.estimate;

import java.math.BigDecimal;

/**
 * One measured entity of a work item. Which fields matter depends on the item's measurement type;
 * the others stay null. A null required field means the value was missing or not numeric at
 * ingestion.
 *
 * @param name optional label, e.g. "North wall"
 * @param sqft area in square feet
 * @param width width in feet, used with height when sqft is absent
 * @param height height in feet
 * @param linearFt length in linear feet
 * @param units count of units
 * @param wasteFactor optional per-surface waste fraction
 */
public record Surface(
    String name,
    BigDecimal sqft,
    BigDecimal width,
    BigDecimal height,
    BigDecimal linearFt,
    BigDecimal units,
    BigDecimal wasteFactor) {

  public static Surface area(BigDecimal sqft) {
    return new Surface(null, sqft, null, null, null, null, null);
  }

  public static Surface rectangle(BigDecimal width, BigDecimal height) {
    return new Surface(null, null, width, height, null, null, null);
  }

  public static Surface length(BigDecimal linearFt) {
    return new Surface(null, null, null, null, linearFt, null, null);
  }

  public static Surface count(BigDecimal units) {
    return new Surface(null, null, null, null, null, units, null);
  }

  public Surface withName(String name) {
    return new Surface(name, sqft, width, height, linearFt, units, wasteFactor);
  }

  public Surface withWasteFactor(BigDecimal wasteFactor) {
    return new Surface(name, sqft, width, height, linearFt, units, wasteFactor);
  }
}
