package io.b2mash.remodel.estimate;

import io.b2mash.remodel.measurement.MeasurementType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A billable unit of remodeling work. {@code surfaces} is the only measurement representation;
 * legacy flat measurement fields are folded into it by {@link EstimateDocumentReader}.
 *
 * <p>A null {@code measurementType} is allowed and resolved to a default (with a warning) at
 * calculation time. Null entries in {@code surfaces} are kept so the resolver can report them.
 */
public record WorkItem(
    String type,
    String subtype,
    String customName,
    MeasurementType measurementType,
    BigDecimal materialCostPerUnit,
    BigDecimal laborCostPerUnit,
    List<Surface> surfaces,
    String description) {

  public static final String CUSTOM_WORK_TYPE = "custom-work-type";

  public WorkItem {
    surfaces =
        surfaces == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(surfaces));
  }

  public static WorkItem of(
      String type,
      MeasurementType measurementType,
      BigDecimal materialCostPerUnit,
      BigDecimal laborCostPerUnit,
      List<Surface> surfaces) {
    return new WorkItem(
        type, null, null, measurementType, materialCostPerUnit, laborCostPerUnit, surfaces, null);
  }

  public WorkItem withMeasurementType(MeasurementType measurementType) {
    return new WorkItem(
        type,
        subtype,
        customName,
        measurementType,
        materialCostPerUnit,
        laborCostPerUnit,
        surfaces,
        description);
  }

  public boolean isCustomType() {
    return CUSTOM_WORK_TYPE.equals(type);
  }

  /** The custom name when set, otherwise the work type, otherwise "Unnamed Work Item". */
  public String displayName() {
    if (customName != null && !customName.isBlank()) {
      return customName;
    }
    if (type != null && !type.isBlank()) {
      return type;
    }
    return "Unnamed Work Item";
  }
}
