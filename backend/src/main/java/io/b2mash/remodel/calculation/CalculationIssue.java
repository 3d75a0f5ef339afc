package io.b2mash.remodel.calculation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A non-fatal problem found while computing a result. Issues are collected into the {@code errors}
 * or {@code warnings} list of the result instead of being thrown.
 *
 * @param code stable machine-readable code, e.g. {@code NO_VALID_SURFACES}
 * @param message human-readable description
 * @param context extra details (category, item index, offending value); may hold null values
 */
public record CalculationIssue(String code, String message, Map<String, Object> context) {

  public CalculationIssue {
    context =
        context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public static CalculationIssue of(String code, String message) {
    return new CalculationIssue(code, message, Map.of());
  }

  public static CalculationIssue of(String code, String message, Map<String, Object> context) {
    return new CalculationIssue(code, message, context);
  }

  /** Returns a copy with an extra context entry, keeping existing entries. */
  public CalculationIssue withContext(String key, Object value) {
    var merged = new LinkedHashMap<String, Object>(context);
    merged.put(key, value);
    return new CalculationIssue(code, message, merged);
  }
}
