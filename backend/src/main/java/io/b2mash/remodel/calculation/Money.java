package io.b2mash.remodel.calculation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Currency helpers. All monetary outputs carry scale 2, rounded HALF_UP. */
public final class Money {

  public static final int SCALE = 2;
  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

  private Money() {}

  public static BigDecimal round(BigDecimal value) {
    if (value == null) {
      return ZERO;
    }
    return value.setScale(SCALE, RoundingMode.HALF_UP);
  }

  /** Rounds and floors at zero. */
  public static BigDecimal nonNegative(BigDecimal value) {
    var rounded = round(value);
    return rounded.signum() < 0 ? ZERO : rounded;
  }

  /** Fixed two-decimal rendering, e.g. {@code 944.00}. */
  public static String format(BigDecimal value) {
    return round(value).toPlainString();
  }

  public static BigDecimal sum(Iterable<BigDecimal> values) {
    BigDecimal total = ZERO;
    for (BigDecimal value : values) {
      if (value != null) {
        total = total.add(value);
      }
    }
    return total;
  }
}
