package io.b2mash.remodel.measurement;

import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * How a work item's surfaces are measured. Each type reads a different scalar from its surfaces:
 *
 * <ul>
 *   <li>SQUARE_FOOT reads {@code sqft}, or {@code width × height} when sqft is absent
 *   <li>LINEAR_FOOT reads {@code linearFt}
 *   <li>BY_UNIT reads {@code units}
 * </ul>
 */
public enum MeasurementType {
  SQUARE_FOOT("square-foot", "Square Foot", "sqft"),
  LINEAR_FOOT("linear-foot", "Linear Foot", "linear ft"),
  BY_UNIT("by-unit", "By Unit", "units");

  private static final Logger log = LoggerFactory.getLogger(MeasurementType.class);

  private final String value;
  private final String displayName;
  private final String unitLabel;

  MeasurementType(String value, String displayName, String unitLabel) {
    this.value = value;
    this.displayName = displayName;
    this.unitLabel = unitLabel;
  }

  public String getValue() {
    return value;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getUnitLabel() {
    return unitLabel;
  }

  /**
   * Parses a canonical value or one of its legacy spellings. Returns empty for blank or unknown
   * input.
   */
  public static Optional<MeasurementType> fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "square-foot",
          "sqft",
          "sq ft",
          "square foot",
          "square foot (sqft)",
          "single-surface",
          "area" ->
          Optional.of(SQUARE_FOOT);
      case "linear-foot", "linear ft", "linearft", "linear foot", "length" ->
          Optional.of(LINEAR_FOOT);
      case "by-unit", "by unit", "unit", "units", "count" -> Optional.of(BY_UNIT);
      default -> Optional.empty();
    };
  }

  /**
   * Like {@link #fromValue(String)} but never fails: blank input and unknown spellings fall back to
   * SQUARE_FOOT. Unknown spellings are logged.
   */
  public static MeasurementType normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return SQUARE_FOOT;
    }
    return fromValue(raw)
        .orElseGet(
            () -> {
              log.warn("Unknown measurement type '{}', defaulting to {}", raw, SQUARE_FOOT);
              return SQUARE_FOOT;
            });
  }
}
