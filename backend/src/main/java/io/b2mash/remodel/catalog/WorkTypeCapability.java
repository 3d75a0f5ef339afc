package io.b2mash.remodel.catalog;

import io.b2mash.remodel.measurement.MeasurementType;

/**
 * Lookup into the work-type catalog. The catalog is owned by the caller; the engine queries it per
 * work item and never caches answers on its behalf.
 */
public interface WorkTypeCapability {

  /**
   * Returns the measurement type the catalog prescribes for a work type within a category, or null
   * when the catalog has no opinion.
   */
  MeasurementType resolveMeasurementType(String categoryKey, String workType);

  boolean isValidSubtype(String workType, String subtype);

  /** Returns the catalog entry, or null when the work type is unknown. */
  WorkTypeDetails getWorkTypeDetails(String workType);

  /** A catalog that knows nothing and accepts everything. */
  static WorkTypeCapability permissive() {
    return new WorkTypeCapability() {
      @Override
      public MeasurementType resolveMeasurementType(String categoryKey, String workType) {
        return null;
      }

      @Override
      public boolean isValidSubtype(String workType, String subtype) {
        return true;
      }

      @Override
      public WorkTypeDetails getWorkTypeDetails(String workType) {
        return new WorkTypeDetails(workType, null, null, null);
      }
    };
  }
}
