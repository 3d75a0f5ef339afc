package io.b2mash.remodel.estimate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A named group of work items, e.g. "Kitchen". The key is unique within an estimate. */
public record Category(String key, String name, List<WorkItem> workItems) {

  public Category {
    workItems =
        workItems == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(workItems));
  }
}
